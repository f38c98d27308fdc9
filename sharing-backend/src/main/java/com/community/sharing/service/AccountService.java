package com.community.sharing.service;

import com.community.sharing.dto.AccountDTO;
import com.community.sharing.dto.AuthResultDTO;
import com.community.sharing.dto.LoginRequest;
import com.community.sharing.dto.RegisterRequest;

import java.util.UUID;

public interface AccountService {

    /**
     * 注册新账号并签发令牌；用户名或邮箱已存在时抛出 DuplicateIdentityException
     */
    AuthResultDTO register(RegisterRequest request);

    /**
     * 校验用户名和密码，更新最后登录时间并签发新令牌
     */
    AuthResultDTO login(LoginRequest request);

    AccountDTO getAccount(UUID accountId);

    /**
     * 删除账号，级联删除其发布的内容、这些内容上的评分以及其本人的评分
     */
    void deleteAccount(UUID accountId);
}
