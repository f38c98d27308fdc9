package com.community.sharing.service;

import com.community.sharing.repository.AccountRepository;
import com.community.sharing.repository.RatingRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * 显式的级联删除：先删子记录再删父记录，必须在调用方的事务内执行。
 */
@Slf4j
@Component
public class CascadeDeleter {

    private final RatingRepository ratingRepository;
    private final AccountRepository accountRepository;

    public CascadeDeleter(RatingRepository ratingRepository, AccountRepository accountRepository) {
        this.ratingRepository = ratingRepository;
        this.accountRepository = accountRepository;
    }

    /**
     * 删除这些内容上的全部评分，并同步扣减每个评分者的 rating_count。
     *
     * @return 删除的评分条数
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int deleteRatingsOfMedia(Collection<UUID> mediaIds) {
        if (mediaIds.isEmpty()) {
            return 0;
        }
        List<Object[]> raters = ratingRepository.countRatersByMediaIds(mediaIds);
        for (Object[] row : raters) {
            UUID raterId = (UUID) row[0];
            int count = ((Number) row[1]).intValue();
            accountRepository.adjustRatingCount(raterId, -count);
        }
        int deleted = ratingRepository.deleteAllByMediaIds(mediaIds);
        log.debug("级联删除评分: media={}, ratings={}", mediaIds.size(), deleted);
        return deleted;
    }
}
