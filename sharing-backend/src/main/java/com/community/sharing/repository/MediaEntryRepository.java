package com.community.sharing.repository;

import com.community.sharing.entity.MediaCategory;
import com.community.sharing.entity.MediaEntry;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface MediaEntryRepository extends JpaRepository<MediaEntry, UUID> {

    String LIKE_ESCAPE = "!";

    /**
     * 内容列表：各过滤参数为 null 时不生效。
     * pattern 为已转义、已转小写的 LIKE 模式，同时匹配标题与描述。
     * 排序与分页由 Pageable 决定。
     */
    @Query(value = "SELECT m FROM MediaEntry m " +
                   "WHERE (:category IS NULL OR m.category = :category) " +
                   "AND (:accountId IS NULL OR m.accountId = :accountId) " +
                   "AND (:pattern IS NULL " +
                   "     OR LOWER(m.title) LIKE :pattern ESCAPE '!' " +
                   "     OR LOWER(m.description) LIKE :pattern ESCAPE '!')",
           countQuery = "SELECT COUNT(m) FROM MediaEntry m " +
                   "WHERE (:category IS NULL OR m.category = :category) " +
                   "AND (:accountId IS NULL OR m.accountId = :accountId) " +
                   "AND (:pattern IS NULL " +
                   "     OR LOWER(m.title) LIKE :pattern ESCAPE '!' " +
                   "     OR LOWER(m.description) LIKE :pattern ESCAPE '!')")
    Page<MediaEntry> findByFilters(@Param("category") MediaCategory category,
                                   @Param("accountId") UUID accountId,
                                   @Param("pattern") String pattern,
                                   Pageable pageable);

    // 账号删除时级联用：该账号创建的全部内容 ID
    @Query("SELECT m.mediaId FROM MediaEntry m WHERE m.accountId = :accountId")
    List<UUID> findMediaIdsByAccountId(@Param("accountId") UUID accountId);

    long countByAccountId(UUID accountId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM MediaEntry m WHERE m.accountId = :accountId")
    int deleteAllByAccountId(@Param("accountId") UUID accountId);
}
