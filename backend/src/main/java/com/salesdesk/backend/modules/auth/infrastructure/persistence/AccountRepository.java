package com.salesdesk.backend.modules.auth.infrastructure.persistence;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

import com.salesdesk.backend.modules.auth.domain.Account;
import com.salesdesk.backend.modules.auth.domain.AccountType;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AccountRepository extends JpaRepository<Account, UUID> {

    @Query("""
            select a
              from Account a
             where lower(a.userName) = lower(:userName)
               and a.type not in :excludedTypes
            """)
    Optional<Account> findByUserNameExcludingTypes(
            @Param("userName") String userName,
            @Param("excludedTypes") Collection<AccountType> excludedTypes
    );

    @Query("""
            select a
              from Account a
             where lower(a.userName) = lower(:userName)
               and a.type in :types
            """)
    Optional<Account> findByUserNameAndTypeIn(
            @Param("userName") String userName,
            @Param("types") Collection<AccountType> types
    );

    Optional<Account> findFirstByTypeOrderByCreatedAtAsc(AccountType type);

    @EntityGraph(attributePaths = {
            "teams",
            "defaultTeam",
            "portals",
            "portalRoles"
    })
    @Query("select a from Account a where a.id = :id")
    Optional<Account> findWithMembershipsById(@Param("id") UUID id);
}
