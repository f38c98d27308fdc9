package com.community.sharing.dto;

import com.community.sharing.entity.MediaCategory;
import lombok.Data;

/**
 * 已通过校验的部分更新请求。
 * title / category / contentUrl 为 null 表示未提供；
 * description 和 thumbnailUrl 允许显式置空，因此单独记录是否提供。
 */
@Data
public class MediaEntryPatch {
    private String title;
    private MediaCategory category;
    private String contentUrl;

    private String description;
    private boolean descriptionProvided;

    private String thumbnailUrl;
    private boolean thumbnailUrlProvided;

    public void setDescription(String description) {
        this.description = description;
        this.descriptionProvided = true;
    }

    public void setThumbnailUrl(String thumbnailUrl) {
        this.thumbnailUrl = thumbnailUrl;
        this.thumbnailUrlProvided = true;
    }

    public boolean isEmpty() {
        return title == null && category == null && contentUrl == null
                && !descriptionProvided && !thumbnailUrlProvided;
    }
}
