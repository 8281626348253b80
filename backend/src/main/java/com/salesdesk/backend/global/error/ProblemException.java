package com.salesdesk.backend.global.error;

import java.util.Locale;

public class ProblemException extends RuntimeException {

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:salesdesk:";

    private final String code;
    private final String detail;
    private final String type;

    public ProblemException(String code) {
        this(code, null, null);
    }

    public ProblemException(String code, String detail) {
        this(code, detail, null);
    }

    public ProblemException(String code, String detail, Throwable cause) {
        super(code, cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        String normalized = code.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9\\-_.:]+", "-");
        this.type = DEFAULT_TYPE_PREFIX + normalized;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return type;
    }
}
