package kr.jemi.zevent.common.validation;

/**
 * 생성자 끝에서 validateSelf()를 호출해 Bean Validation 제약을 즉시 확인하는 도메인 객체.
 * 위반은 IllegalArgumentException이며 웹 계층에서 INVALID_REQUEST가 된다.
 */
public interface SelfValidating {

    default void validateSelf() {
        ValidationUtils.validate(this);
    }
}
