package com.community.sharing.service;

import com.community.sharing.dto.AccountSummaryDTO;
import com.community.sharing.dto.MediaSummaryDTO;
import com.community.sharing.dto.PageDTO;
import com.community.sharing.dto.RatingDTO;
import com.community.sharing.dto.RatingListQuery;
import com.community.sharing.dto.RatingPatch;
import com.community.sharing.dto.RatingRequest;
import com.community.sharing.dto.RatingStatsDTO;
import com.community.sharing.entity.Account;
import com.community.sharing.entity.MediaEntry;
import com.community.sharing.entity.Rating;
import com.community.sharing.exception.DuplicateRatingException;
import com.community.sharing.exception.ForbiddenException;
import com.community.sharing.exception.NotFoundException;
import com.community.sharing.exception.UnauthorizedException;
import com.community.sharing.repository.AccountRepository;
import com.community.sharing.repository.MediaEntryRepository;
import com.community.sharing.repository.RatingRepository;
import com.community.sharing.util.ConstraintViolations;
import com.community.sharing.util.RatingStatistics;
import com.community.sharing.validation.ListingQueryValidator;
import com.community.sharing.validation.RatingValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@Transactional(readOnly = true)
public class RatingServiceImpl implements RatingService {

    private static final String DUPLICATE_MESSAGE = "Use PUT /ratings/{rating_id} to update your rating";

    private final RatingRepository ratingRepository;
    private final MediaEntryRepository mediaRepository;
    private final AccountRepository accountRepository;
    private final RatingValidator ratingValidator;

    public RatingServiceImpl(RatingRepository ratingRepository,
                             MediaEntryRepository mediaRepository,
                             AccountRepository accountRepository,
                             RatingValidator ratingValidator) {
        this.ratingRepository = ratingRepository;
        this.mediaRepository = mediaRepository;
        this.accountRepository = accountRepository;
        this.ratingValidator = ratingValidator;
    }

    /**
     * 辅助方法：将 Rating 实体转换为 RatingDTO，并填充评分者与内容摘要
     */
    private RatingDTO convertToDTO(Rating entity, Account rater, MediaEntry media) {
        RatingDTO dto = new RatingDTO();
        dto.setRatingId(entity.getRatingId());
        dto.setMediaId(entity.getMediaId());
        dto.setUserId(entity.getAccountId());
        dto.setScore(entity.getScore());
        dto.setComment(entity.getComment());
        if (rater != null) {
            dto.setUser(new AccountSummaryDTO(rater.getAccountId(), rater.getUsername()));
        }
        if (media != null) {
            dto.setMedia(new MediaSummaryDTO(media.getMediaId(), media.getTitle(), media.getCategory()));
        }
        dto.setCreatedAt(entity.getCreatedAt());
        dto.setUpdatedAt(entity.getUpdatedAt());
        return dto;
    }

    private RatingDTO convertWithDetails(Rating entity) {
        return convertToDTO(entity,
                accountRepository.findById(entity.getAccountId()).orElse(null),
                mediaRepository.findById(entity.getMediaId()).orElse(null));
    }

    private Rating findExisting(UUID ratingId) {
        return ratingRepository.findById(ratingId)
                .orElseThrow(() -> new NotFoundException("Rating not found"));
    }

    @Override
    @Transactional
    public RatingDTO createRating(UUID accountId, RatingRequest request) {
        MediaEntry media = mediaRepository.findById(request.getMediaId())
                .orElseThrow(() -> new NotFoundException("Media content not found"));
        Account rater = accountRepository.findById(accountId)
                .orElseThrow(() -> new UnauthorizedException("Invalid token", "Account no longer exists"));

        if (ratingRepository.existsByMediaIdAndAccountId(media.getMediaId(), accountId)) {
            log.warn("重复评分: media={}, account={}", media.getMediaId(), accountId);
            throw new DuplicateRatingException("You have already rated this content", DUPLICATE_MESSAGE);
        }

        Rating rating = new Rating();
        rating.setMediaId(media.getMediaId());
        rating.setAccountId(accountId);
        rating.setScore(request.getScore());
        rating.setComment(request.getComment());

        Rating saved;
        try {
            // 并发请求同时通过上面的检查时，由唯一约束和外键决定失败方
            saved = ratingRepository.saveAndFlush(rating);
        } catch (DataIntegrityViolationException e) {
            if (ConstraintViolations.violates(e, Rating.FK_MEDIA)) {
                log.warn("外键拦截评分，内容已被删除: media={}, account={}", media.getMediaId(), accountId);
                throw new NotFoundException("Media content not found");
            }
            if (ConstraintViolations.violates(e, Rating.FK_ACCOUNT)) {
                log.warn("外键拦截评分，账号已被删除: account={}", accountId);
                throw new UnauthorizedException("Invalid token", "Account no longer exists");
            }
            log.warn("唯一约束拦截重复评分: media={}, account={}", media.getMediaId(), accountId);
            throw new DuplicateRatingException("Rating already exists for this content", DUPLICATE_MESSAGE);
        }
        accountRepository.adjustRatingCount(accountId, 1);

        log.info("评分已创建: id={}, media={}, score={}", saved.getRatingId(), media.getMediaId(), saved.getScore());
        return convertToDTO(saved, rater, media);
    }

    @Override
    public PageDTO<RatingDTO> listRatings(RatingListQuery query) {
        Sort sort = Sort.by(Sort.Direction.DESC, "createdAt").and(Sort.by("ratingId"));
        boolean beyondRange = ListingQueryValidator.exceedsMaxOffset(query.getPage(), query.getPerPage());
        PageRequest pageRequest = PageRequest.of(beyondRange ? 0 : query.getPage() - 1, query.getPerPage(), sort);

        Page<Rating> page = ratingRepository.findByFilters(query.getMediaId(), query.getUserId(), pageRequest);
        if (beyondRange) {
            log.debug("评分列表页码越界: page={}, perPage={}", query.getPage(), query.getPerPage());
            return PageDTO.empty(query.getPage(), page);
        }
        List<Rating> entities = page.getContent();

        Set<UUID> accountIds = entities.stream().map(Rating::getAccountId).collect(Collectors.toSet());
        Set<UUID> mediaIds = entities.stream().map(Rating::getMediaId).collect(Collectors.toSet());
        Map<UUID, Account> raters = accountRepository.findAllById(accountIds).stream()
                .collect(Collectors.toMap(Account::getAccountId, Function.identity()));
        Map<UUID, MediaEntry> media = mediaRepository.findAllById(mediaIds).stream()
                .collect(Collectors.toMap(MediaEntry::getMediaId, Function.identity()));

        List<RatingDTO> items = entities.stream()
                .map(entity -> convertToDTO(entity, raters.get(entity.getAccountId()), media.get(entity.getMediaId())))
                .collect(Collectors.toList());
        return PageDTO.of(items, page);
    }

    @Override
    public RatingDTO getRating(UUID ratingId) {
        return convertWithDetails(findExisting(ratingId));
    }

    @Override
    @Transactional
    public RatingDTO updateRating(UUID ratingId, UUID accountId, Map<String, Object> body) {
        Rating rating = findExisting(ratingId);
        if (!rating.getAccountId().equals(accountId)) {
            log.warn("拒绝更新他人评分: rating={}, caller={}", ratingId, accountId);
            throw new ForbiddenException("Forbidden: You can only update your own ratings");
        }
        RatingPatch patch = ratingValidator.validateUpdate(body);

        if (patch.getScore() != null) {
            rating.setScore(patch.getScore());
        }
        if (patch.isCommentProvided()) {
            rating.setComment(patch.getComment());
        }

        Rating saved = ratingRepository.saveAndFlush(rating);
        log.info("评分已更新: id={}", ratingId);
        return convertWithDetails(saved);
    }

    @Override
    @Transactional
    public void deleteRating(UUID ratingId, UUID accountId) {
        Rating rating = findExisting(ratingId);
        if (!rating.getAccountId().equals(accountId)) {
            log.warn("拒绝删除他人评分: rating={}, caller={}", ratingId, accountId);
            throw new ForbiddenException("Forbidden: You can only delete your own ratings");
        }

        ratingRepository.delete(rating);
        accountRepository.adjustRatingCount(accountId, -1);
        log.info("评分已删除: id={}", ratingId);
    }

    @Override
    public RatingStatsDTO getMediaStats(UUID mediaId) {
        MediaEntry media = mediaRepository.findById(mediaId)
                .orElseThrow(() -> new NotFoundException("Media content not found"));

        Map<String, Long> distribution = RatingStatistics.distribution(ratingRepository.countScoresByMediaId(mediaId));

        RatingStatsDTO dto = new RatingStatsDTO();
        dto.setMediaId(media.getMediaId());
        dto.setMediaTitle(media.getTitle());
        dto.setTotalRatings(RatingStatistics.total(distribution));
        dto.setAverageRating(RatingStatistics.average(distribution));
        dto.setRatingDistribution(distribution);
        return dto;
    }
}
