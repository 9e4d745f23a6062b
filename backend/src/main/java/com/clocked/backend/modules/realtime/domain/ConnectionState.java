package com.clocked.backend.modules.realtime.domain;

public enum ConnectionState {
    CONNECTING,
    AUTHENTICATED,
    CLOSED
}
