package com.clocked.backend.modules.group.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;

/**
 * Membership row maintained by the group module's CRUD routes; read-only here.
 */
@Entity
@Table(name = "group_member")
public class GroupMembership {

    @EmbeddedId
    private GroupMembershipId id;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private GroupRole role;

    @Column(name = "joined_at", nullable = false)
    private OffsetDateTime joinedAt;

    protected GroupMembership() {
    }

    public GroupMembership(UUID groupId, UUID userId, GroupRole role, OffsetDateTime joinedAt) {
        this.id = new GroupMembershipId(groupId, userId);
        this.role = role;
        this.joinedAt = joinedAt;
    }

    public GroupMembershipId getId() {
        return id;
    }

    public UUID getGroupId() {
        return id.getGroupId();
    }

    public UUID getUserId() {
        return id.getUserId();
    }

    public GroupRole getRole() {
        return role;
    }

    public OffsetDateTime getJoinedAt() {
        return joinedAt;
    }
}
