package com.salesdesk.backend.global.error;

/**
 * The seeded system account is absent. Indicates a broken deployment rather than a bad login,
 * so it is never folded into an authentication failure.
 */
public class SystemAccountMissingException extends ProblemException {

    public SystemAccountMissingException() {
        super("auth.system_account_missing", "System account is not found.");
    }
}
