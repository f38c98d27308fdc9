package com.community.sharing.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 账号信息（仅返回给本人，包含邮箱；密码哈希永不输出）
 */
@Data
public class AccountDTO {
    private UUID userId;
    private String username;
    private String email;
    private Integer ratingCount;
    private LocalDateTime lastLogin;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
