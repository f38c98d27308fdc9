package com.community.sharing.service;

import com.community.sharing.dto.AccountDTO;
import com.community.sharing.dto.AuthResultDTO;
import com.community.sharing.dto.LoginRequest;
import com.community.sharing.dto.RegisterRequest;
import com.community.sharing.entity.Account;
import com.community.sharing.exception.DuplicateIdentityException;
import com.community.sharing.exception.InvalidCredentialsException;
import com.community.sharing.exception.NotFoundException;
import com.community.sharing.repository.AccountRepository;
import com.community.sharing.repository.MediaEntryRepository;
import com.community.sharing.repository.RatingRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@Transactional(readOnly = true)
public class AccountServiceImpl implements AccountService {

    private final AccountRepository accountRepository;
    private final MediaEntryRepository mediaRepository;
    private final RatingRepository ratingRepository;
    private final CascadeDeleter cascadeDeleter;
    private final PasswordEncoder passwordEncoder;
    private final TokenService tokenService;
    private final Clock clock;

    public AccountServiceImpl(AccountRepository accountRepository,
                              MediaEntryRepository mediaRepository,
                              RatingRepository ratingRepository,
                              CascadeDeleter cascadeDeleter,
                              PasswordEncoder passwordEncoder,
                              TokenService tokenService,
                              Clock clock) {
        this.accountRepository = accountRepository;
        this.mediaRepository = mediaRepository;
        this.ratingRepository = ratingRepository;
        this.cascadeDeleter = cascadeDeleter;
        this.passwordEncoder = passwordEncoder;
        this.tokenService = tokenService;
        this.clock = clock;
    }

    /**
     * 辅助方法：将 Account 实体转换为 AccountDTO（含邮箱，仅用于本人）
     */
    static AccountDTO convertToDTO(Account account) {
        AccountDTO dto = new AccountDTO();
        dto.setUserId(account.getAccountId());
        dto.setUsername(account.getUsername());
        dto.setEmail(account.getEmail());
        dto.setRatingCount(account.getRatingCount());
        dto.setLastLogin(account.getLastLogin());
        dto.setCreatedAt(account.getCreatedAt());
        dto.setUpdatedAt(account.getUpdatedAt());
        return dto;
    }

    @Override
    @Transactional
    public AuthResultDTO register(RegisterRequest request) {
        if (accountRepository.existsByUsername(request.getUsername())) {
            log.warn("注册失败，用户名已存在: {}", request.getUsername());
            throw new DuplicateIdentityException("Username already exists");
        }
        if (accountRepository.existsByEmail(request.getEmail())) {
            log.warn("注册失败，邮箱已存在: {}", request.getEmail());
            throw new DuplicateIdentityException("Email already exists");
        }

        Account account = new Account();
        account.setUsername(request.getUsername());
        account.setEmail(request.getEmail());
        account.setPasswordHash(passwordEncoder.encode(request.getPassword()));
        account.setRatingCount(0);

        Account saved;
        try {
            // 立即 flush，让并发注册触发的唯一约束冲突在这里暴露
            saved = accountRepository.saveAndFlush(account);
        } catch (DataIntegrityViolationException e) {
            log.warn("注册失败，唯一约束冲突: username={}", request.getUsername());
            throw new DuplicateIdentityException("User already exists");
        }

        String token = tokenService.issueToken(saved.getAccountId());
        log.info("账号注册成功: id={}, username={}", saved.getAccountId(), saved.getUsername());
        return new AuthResultDTO(convertToDTO(saved), token, tokenService.getExpirationSeconds());
    }

    @Override
    @Transactional
    public AuthResultDTO login(LoginRequest request) {
        Account account = accountRepository.findByUsername(request.getUsername())
                .orElse(null);
        if (account == null || !passwordEncoder.matches(request.getPassword(), account.getPasswordHash())) {
            log.warn("登录失败: username={}", request.getUsername());
            throw new InvalidCredentialsException("Invalid username or password");
        }

        account.setLastLogin(LocalDateTime.now(clock));
        Account saved = accountRepository.saveAndFlush(account);

        String token = tokenService.issueToken(saved.getAccountId());
        log.info("登录成功: id={}", saved.getAccountId());
        return new AuthResultDTO(convertToDTO(saved), token, tokenService.getExpirationSeconds());
    }

    @Override
    public AccountDTO getAccount(UUID accountId) {
        return accountRepository.findById(accountId)
                .map(AccountServiceImpl::convertToDTO)
                .orElseThrow(() -> new NotFoundException("User not found"));
    }

    @Override
    @Transactional
    public void deleteAccount(UUID accountId) {
        if (!accountRepository.existsById(accountId)) {
            throw new NotFoundException("User not found");
        }

        // 1. 本人内容上的评分（扣减其他评分者的计数）
        List<UUID> mediaIds = mediaRepository.findMediaIdsByAccountId(accountId);
        int mediaRatings = cascadeDeleter.deleteRatingsOfMedia(mediaIds);
        // 2. 本人发表的评分
        int ownRatings = ratingRepository.deleteAllByAccountId(accountId);
        // 3. 本人内容
        int media = mediaRepository.deleteAllByAccountId(accountId);
        // 4. 账号本身
        accountRepository.deleteById(accountId);

        log.info("账号已删除: id={}, media={}, ratings={}", accountId, media, mediaRatings + ownRatings);
    }
}
