package kr.jemi.zevent.ticket.domain;

public enum PaymentProviderType {

    STRIPE("stripe"),
    PAYPAL("paypal");

    private final String value;

    PaymentProviderType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static PaymentProviderType from(String value) {
        for (PaymentProviderType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("알 수 없는 결제사: " + value);
    }
}
