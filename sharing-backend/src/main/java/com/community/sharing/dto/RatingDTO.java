package com.community.sharing.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
public class RatingDTO {
    private UUID ratingId;
    private UUID mediaId;
    private UUID userId;
    private Integer score;
    private String comment;
    private AccountSummaryDTO user;
    private MediaSummaryDTO media;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
