package com.community.sharing.service;

import com.community.sharing.dto.AccountSummaryDTO;
import com.community.sharing.dto.MediaEntryDTO;
import com.community.sharing.dto.MediaEntryPatch;
import com.community.sharing.dto.MediaEntryRequest;
import com.community.sharing.dto.MediaListQuery;
import com.community.sharing.dto.MediaStatsDTO;
import com.community.sharing.dto.PageDTO;
import com.community.sharing.entity.Account;
import com.community.sharing.entity.MediaCategory;
import com.community.sharing.entity.MediaEntry;
import com.community.sharing.exception.ForbiddenException;
import com.community.sharing.exception.NotFoundException;
import com.community.sharing.exception.UnauthorizedException;
import com.community.sharing.repository.AccountRepository;
import com.community.sharing.repository.MediaEntryRepository;
import com.community.sharing.repository.RatingRepository;
import com.community.sharing.util.ConstraintViolations;
import com.community.sharing.validation.ListingQueryValidator;
import com.community.sharing.validation.MediaEntryValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@Transactional(readOnly = true)
public class MediaEntryServiceImpl implements MediaEntryService {

    private final MediaEntryRepository mediaRepository;
    private final RatingRepository ratingRepository;
    private final AccountRepository accountRepository;
    private final CascadeDeleter cascadeDeleter;
    private final MediaEntryValidator mediaEntryValidator;

    public MediaEntryServiceImpl(MediaEntryRepository mediaRepository,
                                 RatingRepository ratingRepository,
                                 AccountRepository accountRepository,
                                 CascadeDeleter cascadeDeleter,
                                 MediaEntryValidator mediaEntryValidator) {
        this.mediaRepository = mediaRepository;
        this.ratingRepository = ratingRepository;
        this.accountRepository = accountRepository;
        this.cascadeDeleter = cascadeDeleter;
        this.mediaEntryValidator = mediaEntryValidator;
    }

    /**
     * 辅助方法：将 MediaEntry 实体转换为 MediaEntryDTO，并填充创建者与统计信息
     */
    private MediaEntryDTO convertToDTO(MediaEntry entity, Account creator, MediaStatsDTO stats) {
        MediaEntryDTO dto = new MediaEntryDTO();
        dto.setMediaId(entity.getMediaId());
        dto.setTitle(entity.getTitle());
        dto.setDescription(entity.getDescription());
        dto.setCategory(entity.getCategory());
        dto.setThumbnailUrl(entity.getThumbnailUrl());
        dto.setContentUrl(entity.getContentUrl());
        dto.setUserId(entity.getAccountId());
        if (creator != null) {
            dto.setCreator(new AccountSummaryDTO(creator.getAccountId(), creator.getUsername()));
        }
        dto.setStats(stats != null ? stats : MediaStatsDTO.empty());
        dto.setCreatedAt(entity.getCreatedAt());
        dto.setUpdatedAt(entity.getUpdatedAt());
        return dto;
    }

    private MediaEntryDTO convertWithDetails(MediaEntry entity) {
        Account creator = accountRepository.findById(entity.getAccountId()).orElse(null);
        MediaStatsDTO stats = loadStats(List.of(entity.getMediaId())).get(entity.getMediaId());
        return convertToDTO(entity, creator, stats);
    }

    /**
     * 批量读取评分统计，没有评分的内容不在返回的 Map 中。
     */
    private Map<UUID, MediaStatsDTO> loadStats(Collection<UUID> mediaIds) {
        if (mediaIds.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<UUID, MediaStatsDTO> stats = new HashMap<>();
        for (Object[] row : ratingRepository.summarizeByMediaIds(mediaIds)) {
            long total = ((Number) row[1]).longValue();
            double average = row[2] == null ? 0.0 : ((Number) row[2]).doubleValue();
            stats.put((UUID) row[0], new MediaStatsDTO(total, average));
        }
        return stats;
    }

    /**
     * 关键字 → 不区分大小写的包含匹配模式，转义 LIKE 通配符；空关键字返回 null。
     */
    static String toLikePattern(String search) {
        if (search == null || search.isEmpty()) {
            return null;
        }
        String escape = MediaEntryRepository.LIKE_ESCAPE;
        String escaped = search.toLowerCase(Locale.ROOT)
                .replace(escape, escape + escape)
                .replace("%", escape + "%")
                .replace("_", escape + "_");
        return "%" + escaped + "%";
    }

    private MediaEntry findExisting(UUID mediaId) {
        return mediaRepository.findById(mediaId)
                .orElseThrow(() -> new NotFoundException("Content not found"));
    }

    @Override
    @Transactional
    public MediaEntryDTO createMediaEntry(UUID accountId, MediaEntryRequest request) {
        Account creator = accountRepository.findById(accountId)
                .orElseThrow(() -> new UnauthorizedException("Invalid token", "Account no longer exists"));

        MediaEntry entry = new MediaEntry();
        entry.setTitle(request.getTitle());
        entry.setDescription(request.getDescription());
        entry.setCategory(request.getCategory());
        entry.setThumbnailUrl(request.getThumbnailUrl());
        entry.setContentUrl(request.getContentUrl());
        entry.setAccountId(accountId);

        MediaEntry saved;
        try {
            saved = mediaRepository.saveAndFlush(entry);
        } catch (DataIntegrityViolationException e) {
            if (ConstraintViolations.violates(e, MediaEntry.FK_ACCOUNT)) {
                // 检查之后、写入之前账号被并发删除
                log.warn("外键拦截内容创建，账号已被删除: account={}", accountId);
                throw new UnauthorizedException("Invalid token", "Account no longer exists");
            }
            throw e;
        }
        log.info("内容已创建: id={}, creator={}, category={}",
                saved.getMediaId(), accountId, saved.getCategory().getValue());
        return convertToDTO(saved, creator, MediaStatsDTO.empty());
    }

    @Override
    public PageDTO<MediaEntryDTO> listMediaEntries(MediaListQuery query) {
        // 次级按 ID 排序，保证分页结果稳定
        Sort sort = Sort.by(query.getDirection(), query.getSortProperty()).and(Sort.by("mediaId"));
        boolean beyondRange = ListingQueryValidator.exceedsMaxOffset(query.getPage(), query.getPerPage());
        PageRequest pageRequest = PageRequest.of(beyondRange ? 0 : query.getPage() - 1, query.getPerPage(), sort);

        Page<MediaEntry> page = mediaRepository.findByFilters(query.getCategory(), query.getCreatorId(),
                toLikePattern(query.getSearch()), pageRequest);
        if (beyondRange) {
            log.debug("内容列表页码越界: page={}, perPage={}", query.getPage(), query.getPerPage());
            return PageDTO.empty(query.getPage(), page);
        }
        List<MediaEntry> entities = page.getContent();

        Set<UUID> creatorIds = entities.stream().map(MediaEntry::getAccountId).collect(Collectors.toSet());
        Map<UUID, Account> creators = accountRepository.findAllById(creatorIds).stream()
                .collect(Collectors.toMap(Account::getAccountId, Function.identity()));
        Map<UUID, MediaStatsDTO> stats = loadStats(
                entities.stream().map(MediaEntry::getMediaId).collect(Collectors.toList()));

        List<MediaEntryDTO> items = entities.stream()
                .map(entity -> convertToDTO(entity,
                        creators.get(entity.getAccountId()),
                        stats.get(entity.getMediaId())))
                .collect(Collectors.toList());
        return PageDTO.of(items, page);
    }

    @Override
    public MediaEntryDTO getMediaEntry(UUID mediaId) {
        return convertWithDetails(findExisting(mediaId));
    }

    @Override
    @Transactional
    public MediaEntryDTO updateMediaEntry(UUID mediaId, UUID accountId, Map<String, Object> body) {
        MediaEntry entry = findExisting(mediaId);
        if (!entry.getAccountId().equals(accountId)) {
            log.warn("拒绝更新他人内容: media={}, caller={}", mediaId, accountId);
            throw new ForbiddenException("Forbidden: You can only update your own content");
        }
        MediaEntryPatch patch = mediaEntryValidator.validateUpdate(body);

        if (patch.getTitle() != null) {
            entry.setTitle(patch.getTitle());
        }
        if (patch.isDescriptionProvided()) {
            entry.setDescription(patch.getDescription());
        }
        if (patch.getCategory() != null) {
            entry.setCategory(patch.getCategory());
        }
        if (patch.isThumbnailUrlProvided()) {
            entry.setThumbnailUrl(patch.getThumbnailUrl());
        }
        if (patch.getContentUrl() != null) {
            entry.setContentUrl(patch.getContentUrl());
        }

        MediaEntry saved = mediaRepository.saveAndFlush(entry);
        log.info("内容已更新: id={}", mediaId);
        return convertWithDetails(saved);
    }

    @Override
    @Transactional
    public void deleteMediaEntry(UUID mediaId, UUID accountId) {
        MediaEntry entry = findExisting(mediaId);
        if (!entry.getAccountId().equals(accountId)) {
            log.warn("拒绝删除他人内容: media={}, caller={}", mediaId, accountId);
            throw new ForbiddenException("Forbidden: You can only delete your own content");
        }

        int ratings = cascadeDeleter.deleteRatingsOfMedia(List.of(mediaId));
        mediaRepository.deleteById(mediaId);
        log.info("内容已删除: id={}, ratings={}", mediaId, ratings);
    }

    @Override
    public List<String> getCategories() {
        return MediaCategory.allValues();
    }
}
