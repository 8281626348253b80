package com.salesdesk.backend.modules.auth.application;

/**
 * @param token previously issued raw token; when present the password is not checked
 */
public record LoginCommand(
        String username,
        String password,
        String token,
        boolean portal,
        String remoteAddress
) {

    @Override
    public String toString() {
        return "LoginCommand[username=" + username + ", portal=" + portal + ", remoteAddress=" + remoteAddress + "]";
    }
}
