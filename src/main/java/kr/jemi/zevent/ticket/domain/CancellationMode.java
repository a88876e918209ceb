package kr.jemi.zevent.ticket.domain;

public enum CancellationMode {

    /** 환불 가능하면 환불, 아니면 환불 없이 취소 */
    AUTO,
    /** 환불 불가면 실패 */
    REFUND,
    /** 결제사를 호출하지 않고 취소 */
    NO_REFUND;

    public static CancellationMode from(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        return valueOf(value.trim().toUpperCase());
    }
}
