package com.community.sharing.controller;

import com.community.sharing.dto.AuthResultDTO;
import com.community.sharing.dto.CommonResponse;
import com.community.sharing.service.AccountService;
import com.community.sharing.validation.AccountValidator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/sessions")
public class SessionController {

    private final AccountService accountService;
    private final AccountValidator accountValidator;

    public SessionController(AccountService accountService, AccountValidator accountValidator) {
        this.accountService = accountService;
        this.accountValidator = accountValidator;
    }

    /**
     * **路径: POST /sessions**
     * 功能: 用户名 + 密码登录，签发新令牌
     */
    @PostMapping
    public ResponseEntity<CommonResponse<AuthResultDTO>> login(
            @RequestBody(required = false) Map<String, Object> body) {
        AuthResultDTO result = accountService.login(accountValidator.validateLogin(body));
        return ResponseEntity.ok(CommonResponse.success("Login successful", result));
    }
}
