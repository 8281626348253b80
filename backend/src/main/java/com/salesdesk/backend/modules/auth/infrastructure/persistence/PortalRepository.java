package com.salesdesk.backend.modules.auth.infrastructure.persistence;

import java.util.UUID;

import com.salesdesk.backend.modules.auth.domain.Portal;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PortalRepository extends JpaRepository<Portal, UUID> {
}
