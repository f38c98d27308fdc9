package com.community.sharing.controller;

import com.community.sharing.dto.AccountDTO;
import com.community.sharing.dto.AuthResultDTO;
import com.community.sharing.dto.CommonResponse;
import com.community.sharing.filter.BearerTokenFilter;
import com.community.sharing.service.AccountService;
import com.community.sharing.validation.AccountValidator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/accounts")
public class AccountController {

    private final AccountService accountService;
    private final AccountValidator accountValidator;

    public AccountController(AccountService accountService, AccountValidator accountValidator) {
        this.accountService = accountService;
        this.accountValidator = accountValidator;
    }

    /**
     * **路径: POST /accounts**
     * 功能: 注册新账号，返回账号信息与访问令牌（无需登录）
     */
    @PostMapping
    public ResponseEntity<CommonResponse<AuthResultDTO>> register(
            @RequestBody(required = false) Map<String, Object> body) {
        AuthResultDTO result = accountService.register(accountValidator.validateRegistration(body));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CommonResponse.created("User created successfully", result));
    }

    /**
     * **路径: GET /accounts/me**
     * 功能: 当前登录账号信息
     */
    @GetMapping("/me")
    public ResponseEntity<CommonResponse<AccountDTO>> me(
            @RequestAttribute(BearerTokenFilter.ACCOUNT_ID_ATTRIBUTE) UUID accountId) {
        return ResponseEntity.ok(CommonResponse.success(accountService.getAccount(accountId)));
    }

    /**
     * **路径: DELETE /accounts/me**
     * 功能: 注销当前账号，级联删除其内容与评分
     */
    @DeleteMapping("/me")
    public ResponseEntity<CommonResponse<Void>> deleteMe(
            @RequestAttribute(BearerTokenFilter.ACCOUNT_ID_ATTRIBUTE) UUID accountId) {
        accountService.deleteAccount(accountId);
        return ResponseEntity.ok(CommonResponse.success("Account deleted successfully", null));
    }
}
