package com.salesdesk.backend.modules.audit.application;

import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

public final class AuditMarkers {

    /**
     * Alert-level security events (token misuse). Log routing may ship these separately from diagnostics.
     */
    public static final Marker SECURITY_ALERT = MarkerFactory.getMarker("SECURITY_ALERT");

    private AuditMarkers() {
    }
}
