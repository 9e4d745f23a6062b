package com.clocked.backend.modules.group.domain;

/**
 * Role inside a group. A role satisfies every requirement of equal or lower rank.
 */
public enum GroupRole {
    MEMBER(1),
    ADMIN(2),
    OWNER(3);

    private final int rank;

    GroupRole(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean satisfies(GroupRole required) {
        return rank >= required.rank;
    }
}
