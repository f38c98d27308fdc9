package com.community.sharing.repository;

import com.community.sharing.entity.Account;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface AccountRepository extends JpaRepository<Account, UUID> {

    Optional<Account> findByUsername(String username);

    boolean existsByUsername(String username);

    boolean existsByEmail(String email);

    /**
     * 原子地调整冗余评分计数，避免并发评分时的丢失更新。
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Account a SET a.ratingCount = a.ratingCount + :delta WHERE a.accountId = :accountId")
    int adjustRatingCount(@Param("accountId") UUID accountId, @Param("delta") int delta);
}
