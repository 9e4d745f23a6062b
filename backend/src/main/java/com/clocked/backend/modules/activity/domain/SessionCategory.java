package com.clocked.backend.modules.activity.domain;

public enum SessionCategory {
    WORK,
    STUDY,
    EXERCISE,
    HOBBY,
    SOCIAL,
    OTHER
}
