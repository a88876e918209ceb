package kr.jemi.zevent.common.validation;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;

import java.util.Set;
import java.util.stream.Collectors;

public final class ValidationUtils {

    private static final ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
    private static final Validator validator = factory.getValidator();

    private ValidationUtils() {}

    /**
     * @throws IllegalArgumentException 위반 필드를 경로순으로 모은 메시지
     */
    public static void validate(Object target) {
        Set<ConstraintViolation<Object>> violations = validator.validate(target);
        if (violations.isEmpty()) {
            return;
        }
        String details = violations.stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .sorted()
                .collect(Collectors.joining(", "));
        throw new IllegalArgumentException(target.getClass().getSimpleName() + " 검증 실패: " + details);
    }
}
