package com.clocked.backend.modules.activity.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;

/**
 * Read-only view of a tracked activity session. A session is active while {@code endTs} is null.
 */
@Entity
@Immutable
@Table(name = "activity_session")
public class ActivitySession {

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "user_id", nullable = false, columnDefinition = "uuid")
    private UUID userId;

    @Column(name = "group_id", nullable = false, columnDefinition = "uuid")
    private UUID groupId;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 16)
    private SessionCategory category;

    @Column(name = "start_ts", nullable = false)
    private OffsetDateTime startTs;

    @Column(name = "end_ts")
    private OffsetDateTime endTs;

    @Column(name = "target_min", nullable = false)
    private int targetMin;

    @Column(name = "location_coarse", length = 100)
    private String locationCoarse;

    @Column(name = "note", length = 500)
    private String note;

    @Enumerated(EnumType.STRING)
    @Column(name = "visibility", nullable = false, length = 16)
    private SessionVisibility visibility;

    protected ActivitySession() {
    }

    public UUID getId() {
        return id;
    }

    public UUID getUserId() {
        return userId;
    }

    public UUID getGroupId() {
        return groupId;
    }

    public SessionCategory getCategory() {
        return category;
    }

    public OffsetDateTime getStartTs() {
        return startTs;
    }

    public OffsetDateTime getEndTs() {
        return endTs;
    }

    public int getTargetMin() {
        return targetMin;
    }

    public String getLocationCoarse() {
        return locationCoarse;
    }

    public String getNote() {
        return note;
    }

    public SessionVisibility getVisibility() {
        return visibility;
    }
}
