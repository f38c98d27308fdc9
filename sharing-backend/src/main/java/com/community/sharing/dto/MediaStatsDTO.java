package com.community.sharing.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MediaStatsDTO {
    private Long totalRatings;
    private Double averageRating;   // 无评分时为 0

    public static MediaStatsDTO empty() {
        return new MediaStatsDTO(0L, 0.0);
    }
}
