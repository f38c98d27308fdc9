package com.community.sharing.dto;

import lombok.Data;

import java.util.Map;
import java.util.UUID;

/**
 * 单个内容的评分统计
 */
@Data
public class RatingStatsDTO {
    private UUID mediaId;
    private String mediaTitle;
    private Long totalRatings;
    private Double averageRating;                 // 保留两位小数，无评分时为 0
    private Map<String, Long> ratingDistribution; // "1".."5" 全部存在
}
