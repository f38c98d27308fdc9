package com.community.sharing.service;

import com.community.sharing.dto.MediaEntryDTO;
import com.community.sharing.dto.MediaEntryRequest;
import com.community.sharing.dto.MediaListQuery;
import com.community.sharing.dto.PageDTO;

import java.util.List;
import java.util.Map;
import java.util.UUID;

public interface MediaEntryService {

    MediaEntryDTO createMediaEntry(UUID accountId, MediaEntryRequest request);

    /**
     * 按条件分页查询内容列表，每条附带创建者信息与评分统计
     */
    PageDTO<MediaEntryDTO> listMediaEntries(MediaListQuery query);

    MediaEntryDTO getMediaEntry(UUID mediaId);

    /**
     * 部分更新，仅创建者可操作；依次判断是否存在 (404)、所有权 (403)，最后校验请求体 (400)
     */
    MediaEntryDTO updateMediaEntry(UUID mediaId, UUID accountId, Map<String, Object> body);

    /**
     * 删除内容并级联删除其评分，仅创建者可操作
     */
    void deleteMediaEntry(UUID mediaId, UUID accountId);

    List<String> getCategories();
}
