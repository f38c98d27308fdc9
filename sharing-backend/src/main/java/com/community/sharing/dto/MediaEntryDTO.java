package com.community.sharing.dto;

import com.community.sharing.entity.MediaCategory;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
public class MediaEntryDTO {
    private UUID mediaId;
    private String title;
    private String description;
    private MediaCategory category;     // 输出为小写取值
    private String thumbnailUrl;
    private String contentUrl;
    private UUID userId;                // 创建者 ID
    private AccountSummaryDTO creator;
    private MediaStatsDTO stats;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
