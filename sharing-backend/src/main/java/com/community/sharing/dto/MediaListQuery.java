package com.community.sharing.dto;

import com.community.sharing.entity.MediaCategory;
import lombok.Data;
import org.springframework.data.domain.Sort;

import java.util.UUID;

/**
 * 内容列表查询参数（已校验、已归一化）
 */
@Data
public class MediaListQuery {
    private int page = 1;
    private int perPage = 10;
    private MediaCategory category;
    private UUID creatorId;
    private String search;
    private String sortProperty = "createdAt";   // 实体属性名
    private Sort.Direction direction = Sort.Direction.DESC;
}
