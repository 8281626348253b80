package com.salesdesk.backend.modules.auth.application;

import java.util.List;
import java.util.UUID;

import com.salesdesk.backend.global.common.email.EmailAddress;
import com.salesdesk.backend.modules.auth.domain.Account;
import com.salesdesk.backend.modules.auth.domain.Portal;
import com.salesdesk.backend.modules.auth.domain.PortalRole;
import com.salesdesk.backend.modules.auth.domain.Team;

public record AccountProfile(
        UUID accountId,
        String userName,
        String type,
        String fullName,
        String title,
        String emailAddress,
        String phoneNumber,
        List<String> teams,
        String defaultTeam,
        List<String> portals,
        List<String> portalRoles
) {

    public static AccountProfile from(Account account) {
        EmailAddress email = account.getEmailAddress();
        return new AccountProfile(
                account.getId(),
                account.getUserName(),
                account.getType().name(),
                account.getFullName(),
                account.getTitle(),
                email == null ? null : email.getAddress(),
                account.getPhoneNumber(),
                account.getTeams().stream().map(Team::getName).sorted().toList(),
                account.getDefaultTeam() == null ? null : account.getDefaultTeam().getName(),
                account.getPortals().stream().map(Portal::getName).sorted().toList(),
                account.getPortalRoles().stream().map(PortalRole::getName).sorted().toList()
        );
    }
}
