package com.salesdesk.backend.modules.auth.infrastructure.persistence;

import java.util.UUID;

import com.salesdesk.backend.modules.auth.domain.PortalRole;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PortalRoleRepository extends JpaRepository<PortalRole, UUID> {
}
