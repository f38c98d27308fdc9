package com.community.sharing.service;

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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class AccountServiceImplTest {

    @Mock
    private AccountRepository accountRepository;

    @Mock
    private MediaEntryRepository mediaRepository;

    @Mock
    private RatingRepository ratingRepository;

    @Mock
    private CascadeDeleter cascadeDeleter;

    @Mock
    private TokenService tokenService;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);
    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private AccountServiceImpl accountService;

    private UUID accountId;

    @BeforeEach
    void setUp() {
        accountService = new AccountServiceImpl(accountRepository, mediaRepository, ratingRepository,
                cascadeDeleter, passwordEncoder, tokenService, clock);
        accountId = UUID.randomUUID();
    }

    private Account storedAccount(String password) {
        Account account = new Account();
        account.setAccountId(accountId);
        account.setUsername("alice");
        account.setEmail("alice@example.com");
        account.setPasswordHash(passwordEncoder.encode(password));
        account.setRatingCount(0);
        return account;
    }

    @Test
    void testRegister_Success() {
        when(accountRepository.existsByUsername("alice")).thenReturn(false);
        when(accountRepository.existsByEmail("alice@example.com")).thenReturn(false);
        when(accountRepository.saveAndFlush(any(Account.class))).thenAnswer(invocation -> {
            Account account = invocation.getArgument(0);
            account.setAccountId(accountId);
            return account;
        });
        when(tokenService.issueToken(accountId)).thenReturn("token-1");
        when(tokenService.getExpirationSeconds()).thenReturn(3600L);

        AuthResultDTO result = accountService.register(new RegisterRequest("alice", "alice@example.com", "secret1"));

        assertEquals("token-1", result.getAccessToken());
        assertEquals("Bearer", result.getTokenType());
        assertEquals(accountId, result.getUser().getUserId());
        assertEquals("alice@example.com", result.getUser().getEmail());
        assertEquals(0, result.getUser().getRatingCount());

        // 只保存哈希，不保存明文
        ArgumentCaptor<Account> captor = ArgumentCaptor.forClass(Account.class);
        verify(accountRepository).saveAndFlush(captor.capture());
        assertNotEquals("secret1", captor.getValue().getPasswordHash());
        assertTrue(passwordEncoder.matches("secret1", captor.getValue().getPasswordHash()));
    }

    @Test
    void testRegister_DuplicateUsername() {
        when(accountRepository.existsByUsername("alice")).thenReturn(true);

        DuplicateIdentityException ex = assertThrows(DuplicateIdentityException.class,
                () -> accountService.register(new RegisterRequest("alice", "other@example.com", "secret1")));

        assertEquals("Username already exists", ex.getError());
        verify(accountRepository, never()).saveAndFlush(any());
        verify(tokenService, never()).issueToken(any());
    }

    @Test
    void testRegister_DuplicateEmail() {
        when(accountRepository.existsByUsername("bob")).thenReturn(false);
        when(accountRepository.existsByEmail("alice@example.com")).thenReturn(true);

        DuplicateIdentityException ex = assertThrows(DuplicateIdentityException.class,
                () -> accountService.register(new RegisterRequest("bob", "alice@example.com", "secret1")));

        assertEquals("Email already exists", ex.getError());
        verify(accountRepository, never()).saveAndFlush(any());
    }

    @Test
    void testRegister_ConstraintViolationMapsToDuplicate() {
        when(accountRepository.existsByUsername("alice")).thenReturn(false);
        when(accountRepository.existsByEmail("alice@example.com")).thenReturn(false);
        when(accountRepository.saveAndFlush(any(Account.class)))
                .thenThrow(new DataIntegrityViolationException("uk_account_username"));

        assertThrows(DuplicateIdentityException.class,
                () -> accountService.register(new RegisterRequest("alice", "alice@example.com", "secret1")));
        verify(tokenService, never()).issueToken(any());
    }

    @Test
    void testLogin_Success_UpdatesLastLogin() {
        Account account = storedAccount("secret1");
        when(accountRepository.findByUsername("alice")).thenReturn(Optional.of(account));
        when(accountRepository.saveAndFlush(account)).thenReturn(account);
        when(tokenService.issueToken(accountId)).thenReturn("token-2");
        when(tokenService.getExpirationSeconds()).thenReturn(3600L);

        AuthResultDTO result = accountService.login(new LoginRequest("alice", "secret1"));

        assertEquals("token-2", result.getAccessToken());
        assertEquals(LocalDateTime.of(2024, 5, 1, 10, 0), account.getLastLogin());
        assertEquals(LocalDateTime.of(2024, 5, 1, 10, 0), result.getUser().getLastLogin());
    }

    @Test
    void testLogin_WrongPassword() {
        when(accountRepository.findByUsername("alice")).thenReturn(Optional.of(storedAccount("secret1")));

        assertThrows(InvalidCredentialsException.class,
                () -> accountService.login(new LoginRequest("alice", "wrong-password")));
        verify(accountRepository, never()).saveAndFlush(any());
        verify(tokenService, never()).issueToken(any());
    }

    @Test
    void testLogin_UnknownUser() {
        when(accountRepository.findByUsername("ghost")).thenReturn(Optional.empty());

        InvalidCredentialsException ex = assertThrows(InvalidCredentialsException.class,
                () -> accountService.login(new LoginRequest("ghost", "secret1")));
        assertEquals("Invalid username or password", ex.getError());
    }

    @Test
    void testGetAccount_NotFound() {
        when(accountRepository.findById(accountId)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> accountService.getAccount(accountId));
    }

    @Test
    void testDeleteAccount_CascadesChildrenBeforeAccount() {
        UUID mediaId = UUID.randomUUID();
        when(accountRepository.existsById(accountId)).thenReturn(true);
        when(mediaRepository.findMediaIdsByAccountId(accountId)).thenReturn(List.of(mediaId));
        when(cascadeDeleter.deleteRatingsOfMedia(List.of(mediaId))).thenReturn(2);
        when(ratingRepository.deleteAllByAccountId(accountId)).thenReturn(1);
        when(mediaRepository.deleteAllByAccountId(accountId)).thenReturn(1);

        accountService.deleteAccount(accountId);

        InOrder inOrder = inOrder(cascadeDeleter, ratingRepository, mediaRepository, accountRepository);
        inOrder.verify(cascadeDeleter).deleteRatingsOfMedia(List.of(mediaId));
        inOrder.verify(ratingRepository).deleteAllByAccountId(accountId);
        inOrder.verify(mediaRepository).deleteAllByAccountId(accountId);
        inOrder.verify(accountRepository).deleteById(accountId);
    }

    @Test
    void testDeleteAccount_NotFound() {
        when(accountRepository.existsById(accountId)).thenReturn(false);

        assertThrows(NotFoundException.class, () -> accountService.deleteAccount(accountId));
        verify(accountRepository, never()).deleteById(any());
    }
}
