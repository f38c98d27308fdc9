package com.community.sharing.dto;

import lombok.Data;

import java.util.UUID;

@Data
public class RatingListQuery {
    private int page = 1;
    private int perPage = 10;
    private UUID mediaId;
    private UUID userId;
}
