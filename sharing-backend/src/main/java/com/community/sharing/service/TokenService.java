package com.community.sharing.service;

import com.community.sharing.exception.UnauthorizedException;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * 无状态会话令牌（HS256 JWT）的签发与校验。
 * 令牌只携带账号 ID 作为 subject，过期是唯一的失效方式。
 */
@Slf4j
@Service
public class TokenService {

    private final SecretKey signingKey;
    private final Duration expiration;
    private final Clock clock;

    public TokenService(@Value("${app.jwt.secret}") String secret,
                        @Value("${app.jwt.expiration-seconds:3600}") long expirationSeconds,
                        Clock clock) {
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expiration = Duration.ofSeconds(expirationSeconds);
        this.clock = clock;
    }

    public String issueToken(UUID accountId) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(accountId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(expiration)))
                .signWith(signingKey)
                .compact();
    }

    /**
     * 校验令牌并返回其中的账号 ID。
     *
     * @throws UnauthorizedException 令牌格式错误、签名不符或已过期
     */
    public UUID verifyToken(String token) {
        String subject;
        try {
            subject = Jwts.parser()
                    .verifyWith(signingKey)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload()
                    .getSubject();
        } catch (ExpiredJwtException e) {
            log.debug("令牌已过期: exp={}", e.getClaims().getExpiration());
            throw new UnauthorizedException("Token has expired", "Please log in again");
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("令牌校验失败: {}", e.getMessage());
            throw new UnauthorizedException("Invalid token", "Please provide a valid token");
        }

        if (subject == null) {
            throw new UnauthorizedException("Invalid token", "Please provide a valid token");
        }
        try {
            return UUID.fromString(subject);
        } catch (IllegalArgumentException e) {
            throw new UnauthorizedException("Invalid token", "Please provide a valid token");
        }
    }

    public long getExpirationSeconds() {
        return expiration.getSeconds();
    }
}
