package com.community.sharing.controller;

import com.community.sharing.dto.CommonResponse;
import com.community.sharing.dto.MediaEntryDTO;
import com.community.sharing.dto.PageDTO;
import com.community.sharing.filter.BearerTokenFilter;
import com.community.sharing.service.MediaEntryService;
import com.community.sharing.validation.ListingQueryValidator;
import com.community.sharing.validation.MediaEntryValidator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/media")
public class MediaEntryController {

    private final MediaEntryService mediaEntryService;
    private final MediaEntryValidator mediaEntryValidator;
    private final ListingQueryValidator listingQueryValidator;

    public MediaEntryController(MediaEntryService mediaEntryService,
                                MediaEntryValidator mediaEntryValidator,
                                ListingQueryValidator listingQueryValidator) {
        this.mediaEntryService = mediaEntryService;
        this.mediaEntryValidator = mediaEntryValidator;
        this.listingQueryValidator = listingQueryValidator;
    }

    @PostMapping
    public ResponseEntity<CommonResponse<MediaEntryDTO>> create(
            @RequestAttribute(BearerTokenFilter.ACCOUNT_ID_ATTRIBUTE) UUID accountId,
            @RequestBody(required = false) Map<String, Object> body) {
        MediaEntryDTO created = mediaEntryService.createMediaEntry(accountId, mediaEntryValidator.validateCreate(body));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CommonResponse.created("Content created successfully", created));
    }

    /**
     * **路径: GET /media?page=&per_page=&category=&creator_id=&search=&sort_by=&order=**
     * 功能: 分页查询内容列表（无需登录）
     */
    @GetMapping
    public ResponseEntity<CommonResponse<PageDTO<MediaEntryDTO>>> list(@RequestParam Map<String, String> params) {
        PageDTO<MediaEntryDTO> page = mediaEntryService.listMediaEntries(listingQueryValidator.validateMediaQuery(params));
        return ResponseEntity.ok(CommonResponse.success(page));
    }

    @GetMapping("/categories")
    public ResponseEntity<CommonResponse<List<String>>> categories() {
        return ResponseEntity.ok(CommonResponse.success(mediaEntryService.getCategories()));
    }

    @GetMapping("/{mediaId}")
    public ResponseEntity<CommonResponse<MediaEntryDTO>> get(@PathVariable("mediaId") UUID mediaId) {
        return ResponseEntity.ok(CommonResponse.success(mediaEntryService.getMediaEntry(mediaId)));
    }

    /**
     * **路径: PUT /media/{mediaId}**
     * 功能: 部分更新内容，仅创建者可操作；请求体在所有权检查之后校验
     */
    @PutMapping("/{mediaId}")
    public ResponseEntity<CommonResponse<MediaEntryDTO>> update(
            @PathVariable("mediaId") UUID mediaId,
            @RequestAttribute(BearerTokenFilter.ACCOUNT_ID_ATTRIBUTE) UUID accountId,
            @RequestBody(required = false) Map<String, Object> body) {
        MediaEntryDTO updated = mediaEntryService.updateMediaEntry(mediaId, accountId, body);
        return ResponseEntity.ok(CommonResponse.success("Content updated successfully", updated));
    }

    @DeleteMapping("/{mediaId}")
    public ResponseEntity<CommonResponse<Void>> delete(
            @PathVariable("mediaId") UUID mediaId,
            @RequestAttribute(BearerTokenFilter.ACCOUNT_ID_ATTRIBUTE) UUID accountId) {
        mediaEntryService.deleteMediaEntry(mediaId, accountId);
        return ResponseEntity.ok(CommonResponse.success("Content deleted successfully", null));
    }
}
