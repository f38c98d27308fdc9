package com.community.sharing.filter;

import com.community.sharing.dto.CommonResponse;
import com.community.sharing.exception.UnauthorizedException;
import com.community.sharing.service.TokenService;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.UUID;

/**
 * Bearer 令牌过滤器 - 拦截需要登录的接口，校验 Authorization 头中的令牌。
 * 校验通过时把账号 ID 放入请求属性 {@link #ACCOUNT_ID_ATTRIBUTE}；
 * 否则直接返回 401，不进入控制器。
 */
@Component
public class BearerTokenFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(BearerTokenFilter.class);

    public static final String ACCOUNT_ID_ATTRIBUTE = "authenticatedAccountId";

    private static final String BEARER_PREFIX = "Bearer ";

    // 无需登录的写接口：注册、登录
    private static final Set<String> PUBLIC_POSTS = Set.of("/accounts", "/sessions");

    private final TokenService tokenService;
    private final ObjectMapper objectMapper;

    public BearerTokenFilter(TokenService tokenService, ObjectMapper objectMapper) {
        this.tokenService = tokenService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        if (!requiresAuthentication(httpRequest)) {
            chain.doFilter(request, response);
            return;
        }

        String header = httpRequest.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            log.warn("拒绝请求: {} {} (缺少 Bearer 令牌)", httpRequest.getMethod(), httpRequest.getRequestURI());
            writeUnauthorized(httpResponse, new UnauthorizedException(
                    "Authorization required", "Please provide an access token"));
            return;
        }

        UUID accountId;
        try {
            accountId = tokenService.verifyToken(header.substring(BEARER_PREFIX.length()).trim());
        } catch (UnauthorizedException e) {
            log.warn("拒绝请求: {} {} ({})", httpRequest.getMethod(), httpRequest.getRequestURI(), e.getError());
            writeUnauthorized(httpResponse, e);
            return;
        }

        httpRequest.setAttribute(ACCOUNT_ID_ATTRIBUTE, accountId);
        chain.doFilter(request, response);
    }

    /**
     * GET 只有 /accounts/me 需要登录；POST 除注册和登录外都需要；PUT / DELETE 全部需要。
     */
    static boolean requiresAuthentication(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        if (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        switch (request.getMethod()) {
            case "GET":
            case "HEAD":
                return "/accounts/me".equals(path);
            case "POST":
                return !PUBLIC_POSTS.contains(path);
            case "PUT":
            case "PATCH":
            case "DELETE":
                return true;
            default:
                return false;
        }
    }

    private void writeUnauthorized(HttpServletResponse response, UnauthorizedException e) throws IOException {
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());

        CommonResponse<Void> body = CommonResponse.error(HttpStatus.UNAUTHORIZED.value(), e.getError(), e.getDetail());
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
