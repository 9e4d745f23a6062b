package com.clocked.backend.modules.activity.domain;

public enum SessionVisibility {
    PUBLIC,
    FRIENDS,
    PRIVATE
}
