package com.community.sharing.util;

import com.community.sharing.entity.Rating;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 评分统计的纯计算部分：均值取整与分布直方图。
 */
public final class RatingStatistics {

    private RatingStatistics() {
    }

    /**
     * 均值保留两位小数（四舍五入），没有评分时返回 0。
     */
    public static double roundAverage(Double average) {
        if (average == null || average.isNaN()) {
            return 0.0;
        }
        return BigDecimal.valueOf(average).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * 由 [score, count] 行构建 "1".."5" 全量分布，缺失的分值补 0。
     */
    public static Map<String, Long> distribution(List<Object[]> scoreCounts) {
        Map<String, Long> distribution = new LinkedHashMap<>();
        for (int score = Rating.MIN_SCORE; score <= Rating.MAX_SCORE; score++) {
            distribution.put(String.valueOf(score), 0L);
        }
        for (Object[] row : scoreCounts) {
            String score = String.valueOf(((Number) row[0]).intValue());
            if (distribution.containsKey(score)) {
                distribution.put(score, ((Number) row[1]).longValue());
            }
        }
        return distribution;
    }

    /**
     * 由分布计算总数与均值，避免再查一次数据库。
     */
    public static long total(Map<String, Long> distribution) {
        return distribution.values().stream().mapToLong(Long::longValue).sum();
    }

    public static double average(Map<String, Long> distribution) {
        long total = total(distribution);
        if (total == 0) {
            return 0.0;
        }
        long sum = 0;
        for (Map.Entry<String, Long> entry : distribution.entrySet()) {
            sum += Long.parseLong(entry.getKey()) * entry.getValue();
        }
        return roundAverage((double) sum / total);
    }
}
