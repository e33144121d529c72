package com.mindcanvus.infrastructure.filter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mindcanvus.application.port.out.TokenService;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AuthFilterTest {

    @Test
    void authEndpointsShouldBePublic() {
        assertTrue(AuthFilter.isPublic("POST", "/api/auth/register"));
        assertTrue(AuthFilter.isPublic("POST", "/api/auth/login"));
        assertFalse(AuthFilter.isPublic("GET", "/api/auth/me"));
    }

    @Test
    void readsOfContentShouldBePublic() {
        assertTrue(AuthFilter.isPublic("GET", "/api/posts"));
        assertTrue(AuthFilter.isPublic("GET", "/api/posts/0190a5d4-0000-7000-8000-000000000000"));
        assertTrue(AuthFilter.isPublic("GET", "/api/comments/post/0190a5d4-0000-7000-8000-000000000000"));
        assertTrue(AuthFilter.isPublic("GET", "/api/users/alice"));
    }

    @Test
    void writesShouldRequireToken() {
        assertFalse(AuthFilter.isPublic("POST", "/api/posts"));
        assertFalse(AuthFilter.isPublic("DELETE", "/api/comments/0190a5d4-0000-7000-8000-000000000000"));
        assertFalse(AuthFilter.isPublic("POST", "/api/users/0190a5d4-0000-7000-8000-000000000000/follow"));
    }

    @Test
    void followSuggestionsShouldRequireToken() {
        assertFalse(AuthFilter.isPublic("GET", "/api/users/suggestions"));
    }

    @Test
    void similarPrefixesShouldNotLeak() {
        assertFalse(AuthFilter.isPublic("GET", "/api/postsecret"));
        assertFalse(AuthFilter.isPublic("GET", "/api/friends"));
        assertFalse(AuthFilter.isPublic("GET", "/api/messages/conversations"));
    }

    @Test
    void operationalEndpointsShouldBePublic() {
        assertTrue(AuthFilter.isPublic("GET", "/api/health"));
        assertTrue(AuthFilter.isPublic("GET", "/actuator/prometheus"));
        assertTrue(AuthFilter.isPublic("GET", "/api-docs"));
    }

    @Test
    void unauthorizedBodyShouldStayValidJsonWhateverTheRequestId() throws Exception {
        // Given
        ObjectMapper objectMapper = new ObjectMapper();
        TokenService tokenService = mock(TokenService.class);
        when(tokenService.verify(anyString())).thenReturn(Optional.empty());
        AuthFilter filter = new AuthFilter(tokenService, objectMapper);

        String requestId = "abc\",\"error\":\"OK\\";
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/friends");
        request.addHeader("X-Request-Id", requestId);
        request.addHeader("Authorization", "Bearer expired");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        // When
        filter.doFilter(request, response, chain);

        // Then
        assertEquals(401, response.getStatus());
        assertNull(chain.getRequest());
        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertEquals("UNAUTHORIZED", body.get("error").asText());
        assertEquals("Invalid or expired token", body.get("message").asText());
        assertEquals(requestId, body.get("requestId").asText());
        assertFalse(body.has("errors"));
    }

    @Test
    void missingTokenShouldBeRejectedOnProtectedRoutes() throws Exception {
        // Given
        ObjectMapper objectMapper = new ObjectMapper();
        AuthFilter filter = new AuthFilter(mock(TokenService.class), objectMapper);
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/messages/conversations");
        MockHttpServletResponse response = new MockHttpServletResponse();

        // When
        filter.doFilter(request, response, new MockFilterChain());

        // Then
        assertEquals(401, response.getStatus());
        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertEquals("No token provided", body.get("message").asText());
        assertEquals(response.getHeader("X-Request-Id"), body.get("requestId").asText());
    }
}
