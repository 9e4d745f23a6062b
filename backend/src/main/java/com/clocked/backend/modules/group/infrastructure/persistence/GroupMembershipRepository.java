package com.clocked.backend.modules.group.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.clocked.backend.modules.group.domain.GroupMembership;
import com.clocked.backend.modules.group.domain.GroupMembershipId;
import com.clocked.backend.modules.group.domain.GroupRole;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface GroupMembershipRepository extends JpaRepository<GroupMembership, GroupMembershipId> {

    @Query("""
            select gm.id.groupId
              from GroupMembership gm
             where gm.id.userId = :userId
            """)
    List<UUID> findGroupIdsByUserId(@Param("userId") UUID userId);

    @Query("""
            select gm.role
              from GroupMembership gm
             where gm.id.userId = :userId
               and gm.id.groupId = :groupId
            """)
    Optional<GroupRole> findRole(@Param("userId") UUID userId, @Param("groupId") UUID groupId);
}
