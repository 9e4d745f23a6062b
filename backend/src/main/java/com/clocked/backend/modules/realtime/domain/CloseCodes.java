package com.clocked.backend.modules.realtime.domain;

public final class CloseCodes {

    public static final int GOING_AWAY = 1001;
    public static final int POLICY_VIOLATION = 1008;
    public static final int SERVER_ERROR = 1011;

    private CloseCodes() {
    }
}
