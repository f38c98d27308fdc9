package com.community.sharing.filter;

import com.community.sharing.exception.UnauthorizedException;
import com.community.sharing.service.TokenService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class BearerTokenFilterTest {

    @Mock
    private TokenService tokenService;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private BearerTokenFilter filter;

    @BeforeEach
    void setUp() {
        filter = new BearerTokenFilter(tokenService, objectMapper);
    }

    @Test
    void testRequiresAuthentication() {
        assertFalse(BearerTokenFilter.requiresAuthentication(new MockHttpServletRequest("GET", "/media")));
        assertFalse(BearerTokenFilter.requiresAuthentication(new MockHttpServletRequest("GET", "/ratings/media/x/stats")));
        assertTrue(BearerTokenFilter.requiresAuthentication(new MockHttpServletRequest("GET", "/accounts/me")));
        assertTrue(BearerTokenFilter.requiresAuthentication(new MockHttpServletRequest("GET", "/accounts/me/")));

        assertFalse(BearerTokenFilter.requiresAuthentication(new MockHttpServletRequest("POST", "/accounts")));
        assertFalse(BearerTokenFilter.requiresAuthentication(new MockHttpServletRequest("POST", "/sessions")));
        assertTrue(BearerTokenFilter.requiresAuthentication(new MockHttpServletRequest("POST", "/media")));
        assertTrue(BearerTokenFilter.requiresAuthentication(new MockHttpServletRequest("POST", "/ratings")));

        assertTrue(BearerTokenFilter.requiresAuthentication(new MockHttpServletRequest("PUT", "/media/x")));
        assertTrue(BearerTokenFilter.requiresAuthentication(new MockHttpServletRequest("DELETE", "/accounts/me")));
    }

    @Test
    void testDoFilter_PublicRequestPassesWithoutToken() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/media");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertNotNull(chain.getRequest());
        assertEquals(200, response.getStatus());
        verifyNoInteractions(tokenService);
    }

    @Test
    void testDoFilter_MissingHeader() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/media");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        // 未进入后续链路
        assertNull(chain.getRequest());
        assertEquals(401, response.getStatus());
        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertEquals("Authorization required", body.get("error").asText());
        assertEquals(401, body.get("code").asInt());
    }

    @Test
    void testDoFilter_NonBearerScheme() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("DELETE", "/ratings/abc");
        request.addHeader("Authorization", "Basic dXNlcjpwYXNz");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertEquals(401, response.getStatus());
        verify(tokenService, never()).verifyToken(anyString());
    }

    @Test
    void testDoFilter_InvalidToken() throws Exception {
        when(tokenService.verifyToken("bad-token"))
                .thenThrow(new UnauthorizedException("Invalid token", "Please provide a valid token"));
        MockHttpServletRequest request = new MockHttpServletRequest("PUT", "/media/abc");
        request.addHeader("Authorization", "Bearer bad-token");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertNull(chain.getRequest());
        assertEquals(401, response.getStatus());
        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertEquals("Invalid token", body.get("error").asText());
        assertEquals("Please provide a valid token", body.get("message").asText());
    }

    @Test
    void testDoFilter_ValidTokenSetsAccountId() throws Exception {
        UUID accountId = UUID.randomUUID();
        when(tokenService.verifyToken("good-token")).thenReturn(accountId);
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/accounts/me");
        request.addHeader("Authorization", "Bearer good-token");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertNotNull(chain.getRequest());
        assertEquals(accountId, request.getAttribute(BearerTokenFilter.ACCOUNT_ID_ATTRIBUTE));
    }
}
