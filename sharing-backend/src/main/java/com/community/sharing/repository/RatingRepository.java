package com.community.sharing.repository;

import com.community.sharing.entity.Rating;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface RatingRepository extends JpaRepository<Rating, UUID> {

    // 评分列表：mediaId / accountId 为 null 时不过滤
    @Query(value = "SELECT r FROM Rating r " +
                   "WHERE (:mediaId IS NULL OR r.mediaId = :mediaId) " +
                   "AND (:accountId IS NULL OR r.accountId = :accountId)",
           countQuery = "SELECT COUNT(r) FROM Rating r " +
                   "WHERE (:mediaId IS NULL OR r.mediaId = :mediaId) " +
                   "AND (:accountId IS NULL OR r.accountId = :accountId)")
    Page<Rating> findByFilters(@Param("mediaId") UUID mediaId,
                               @Param("accountId") UUID accountId,
                               Pageable pageable);

    boolean existsByMediaIdAndAccountId(UUID mediaId, UUID accountId);

    long countByMediaId(UUID mediaId);

    long countByAccountId(UUID accountId);

    /**
     * 按内容汇总评分：返回 [media_id, COUNT, AVG(score)] 的列表，
     * 没有评分的内容不会出现在结果中。
     */
    @Query("SELECT r.mediaId, COUNT(r), AVG(r.score) FROM Rating r " +
           "WHERE r.mediaId IN :mediaIds GROUP BY r.mediaId")
    List<Object[]> summarizeByMediaIds(@Param("mediaIds") Collection<UUID> mediaIds);

    /**
     * 评分分布：返回 [score, COUNT] 的列表，只包含出现过的分值。
     */
    @Query("SELECT r.score, COUNT(r) FROM Rating r WHERE r.mediaId = :mediaId GROUP BY r.score")
    List<Object[]> countScoresByMediaId(@Param("mediaId") UUID mediaId);

    /**
     * 级联删除前统计每个评分者在这些内容上的评分条数：返回 [account_id, COUNT]。
     */
    @Query("SELECT r.accountId, COUNT(r) FROM Rating r WHERE r.mediaId IN :mediaIds GROUP BY r.accountId")
    List<Object[]> countRatersByMediaIds(@Param("mediaIds") Collection<UUID> mediaIds);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Rating r WHERE r.mediaId IN :mediaIds")
    int deleteAllByMediaIds(@Param("mediaIds") Collection<UUID> mediaIds);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Rating r WHERE r.accountId = :accountId")
    int deleteAllByAccountId(@Param("accountId") UUID accountId);
}
