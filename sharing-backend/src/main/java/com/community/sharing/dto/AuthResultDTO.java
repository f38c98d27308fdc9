package com.community.sharing.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 注册 / 登录结果：账号信息 + 访问令牌
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AuthResultDTO {
    private AccountDTO user;
    private String accessToken;
    private String tokenType = "Bearer";
    private Long expiresIn;      // 令牌有效期（秒）

    public AuthResultDTO(AccountDTO user, String accessToken, Long expiresIn) {
        this.user = user;
        this.accessToken = accessToken;
        this.expiresIn = expiresIn;
    }
}
