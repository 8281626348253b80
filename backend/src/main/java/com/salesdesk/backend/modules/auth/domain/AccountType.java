package com.salesdesk.backend.modules.auth.domain;

import java.util.EnumSet;
import java.util.Set;

public enum AccountType {
    REGULAR,
    ADMIN,
    SUPER_ADMIN,
    PORTAL,
    API,
    SYSTEM;

    /**
     * 사람이 로그인하지 않는 계정 유형. 로그인 이름 조회와 유일성 검사에서 제외된다.
     */
    public static final Set<AccountType> NON_INTERACTIVE = EnumSet.of(API, SYSTEM);

    public static final Set<AccountType> ADMINISTRATIVE = EnumSet.of(ADMIN, SUPER_ADMIN);
}
