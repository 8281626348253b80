package com.salesdesk.backend.modules.auth.infrastructure.persistence;

import java.util.UUID;

import com.salesdesk.backend.modules.auth.domain.Team;

import org.springframework.data.jpa.repository.JpaRepository;

public interface TeamRepository extends JpaRepository<Team, UUID> {
}
