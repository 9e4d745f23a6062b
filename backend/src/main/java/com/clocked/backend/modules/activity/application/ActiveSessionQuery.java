package com.clocked.backend.modules.activity.application;

import java.util.List;
import java.util.UUID;

import com.clocked.backend.modules.activity.infrastructure.persistence.ActivitySessionRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class ActiveSessionQuery {

    private final ActivitySessionRepository activitySessionRepository;

    public ActiveSessionQuery(ActivitySessionRepository activitySessionRepository) {
        this.activitySessionRepository = activitySessionRepository;
    }

    public List<ActiveSessionView> activeSessions(UUID groupId) {
        return activitySessionRepository.findActiveViewsByGroupId(groupId);
    }
}
