package com.salesdesk.backend.modules.auth.application;

/**
 * One login attempt as seen by an {@link AuthenticationProvider}.
 *
 * @param authToken     previously issued token, or {@code null} for a password login
 * @param portal        {@code true} when the attempt comes from a portal session
 * @param remoteAddress network origin of the caller, {@code null} when unknown
 */
public record AuthenticationRequest(
        String username,
        String password,
        AuthToken authToken,
        boolean portal,
        String remoteAddress
) {

    public static final String LOGOUT_SENTINEL = "**logout";

    public boolean isLogout() {
        return LOGOUT_SENTINEL.equals(username);
    }

    public boolean hasPassword() {
        return password != null && !password.isEmpty();
    }

    @Override
    public String toString() {
        return "AuthenticationRequest[username=" + username + ", portal=" + portal
                + ", token=" + (authToken != null) + ", remoteAddress=" + remoteAddress + "]";
    }
}
