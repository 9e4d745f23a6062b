package com.clocked.backend.modules.activity.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.clocked.backend.modules.activity.application.ActiveSessionView;
import com.clocked.backend.modules.activity.domain.ActivitySession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ActivitySessionRepository extends JpaRepository<ActivitySession, UUID> {

    @Query("""
            select new com.clocked.backend.modules.activity.application.ActiveSessionView(
                       s.id, s.userId, u.handle, u.photoUrl, u.privacyMode,
                       s.category, s.startTs, s.targetMin, s.locationCoarse, s.note, s.visibility)
              from ActivitySession s
              join UserAccount u on u.id = s.userId
             where s.groupId = :groupId
               and s.endTs is null
             order by s.startTs asc
            """)
    List<ActiveSessionView> findActiveViewsByGroupId(@Param("groupId") UUID groupId);
}
