package com.clocked.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.clocked.backend.modules.auth.domain.UserAccount;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserAccountRepository extends JpaRepository<UserAccount, UUID> {

    @Query("select ua from UserAccount ua where lower(ua.email) = lower(:email)")
    Optional<UserAccount> findByEmailIgnoreCase(@Param("email") String email);

    boolean existsByHandle(String handle);
}
