package com.community.sharing.dto;

import com.community.sharing.entity.MediaCategory;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 已通过校验的创建内容请求
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MediaEntryRequest {
    private String title;
    private String description;
    private MediaCategory category;
    private String thumbnailUrl;
    private String contentUrl;
}
