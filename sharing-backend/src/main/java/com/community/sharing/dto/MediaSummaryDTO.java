package com.community.sharing.dto;

import com.community.sharing.entity.MediaCategory;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

// 评分所属内容的简要信息
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MediaSummaryDTO {
    private UUID mediaId;
    private String title;
    private MediaCategory category;
}
