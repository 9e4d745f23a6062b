package com.clocked.backend.modules.group.application;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.clocked.backend.global.error.ProblemException;
import com.clocked.backend.modules.group.domain.GroupRole;
import com.clocked.backend.modules.group.infrastructure.persistence.GroupMembershipRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-through role checks against group membership. Absent membership never grants anything.
 */
@Service
@Transactional(readOnly = true)
public class PermissionResolver {

    public static final String INSUFFICIENT_PERMISSIONS = "INSUFFICIENT_PERMISSIONS";

    private final GroupMembershipRepository groupMembershipRepository;

    public PermissionResolver(GroupMembershipRepository groupMembershipRepository) {
        this.groupMembershipRepository = groupMembershipRepository;
    }

    public boolean hasPermission(UUID userId, UUID groupId, GroupRole requiredRole) {
        return getRole(userId, groupId)
                .map(role -> role.satisfies(requiredRole))
                .orElse(false);
    }

    public Optional<GroupRole> getRole(UUID userId, UUID groupId) {
        if (userId == null || groupId == null) {
            return Optional.empty();
        }
        return groupMembershipRepository.findRole(userId, groupId);
    }

    public void requirePermission(UUID userId, UUID groupId, GroupRole requiredRole) {
        if (!hasPermission(userId, groupId, requiredRole)) {
            throw ProblemException.forbidden(INSUFFICIENT_PERMISSIONS, "Requires " + requiredRole + " role or higher");
        }
    }

    public Set<UUID> listGroupIds(UUID userId) {
        return new LinkedHashSet<>(groupMembershipRepository.findGroupIdsByUserId(userId));
    }
}
