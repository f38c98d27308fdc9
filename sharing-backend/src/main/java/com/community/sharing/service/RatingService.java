package com.community.sharing.service;

import com.community.sharing.dto.PageDTO;
import com.community.sharing.dto.RatingDTO;
import com.community.sharing.dto.RatingListQuery;
import com.community.sharing.dto.RatingRequest;
import com.community.sharing.dto.RatingStatsDTO;

import java.util.Map;
import java.util.UUID;

public interface RatingService {

    /**
     * 为内容评分；内容不存在抛 NotFoundException，重复评分抛 DuplicateRatingException
     */
    RatingDTO createRating(UUID accountId, RatingRequest request);

    /**
     * 分页查询评分，按创建时间倒序
     */
    PageDTO<RatingDTO> listRatings(RatingListQuery query);

    RatingDTO getRating(UUID ratingId);

    /**
     * 部分更新，仅评分者本人可操作；404、403 检查先于请求体校验
     */
    RatingDTO updateRating(UUID ratingId, UUID accountId, Map<String, Object> body);

    void deleteRating(UUID ratingId, UUID accountId);

    /**
     * 内容评分统计：总数、均值（两位小数）与 1-5 分布
     */
    RatingStatsDTO getMediaStats(UUID mediaId);
}
