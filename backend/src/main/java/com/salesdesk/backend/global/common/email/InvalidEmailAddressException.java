package com.salesdesk.backend.global.common.email;

public class InvalidEmailAddressException extends IllegalArgumentException {

    private final String rawValue;

    public InvalidEmailAddressException(String rawValue) {
        super("Invalid email address: " + rawValue);
        this.rawValue = rawValue;
    }

    public String getRawValue() {
        return rawValue;
    }
}
