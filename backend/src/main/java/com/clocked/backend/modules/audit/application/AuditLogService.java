package com.clocked.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.clocked.backend.global.web.RequestIdFilter;
import com.clocked.backend.modules.audit.domain.AuditLog;
import com.clocked.backend.modules.audit.infrastructure.AuditLogRepository;

import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes audit entries inside the caller's transaction, tagged with the current request id.
 */
@Service
public class AuditLogService {

    public static final String RESOURCE_USER = "user";

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.clock = clock;
    }

    @Transactional
    public AuditLog recordUserAction(String actionType, UUID userId, Map<String, Object> detail) {
        AuditLog entry = new AuditLog(
                actionType,
                RESOURCE_USER,
                userId.toString(),
                userId,
                MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY),
                detail == null || detail.isEmpty() ? null : new LinkedHashMap<>(detail),
                OffsetDateTime.now(clock)
        );
        return auditLogRepository.save(entry);
    }
}
