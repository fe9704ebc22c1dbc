package uk.gegc.costcentre.shared.security;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class GatewayAuthenticationFilterTest {

    private final GatewayAuthenticationFilter filter = new GatewayAuthenticationFilter();

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("authenticates the user header with its authorities")
    void authenticates() throws Exception {
        UUID userId = UUID.randomUUID();
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/cost/summary");
        request.addHeader(GatewayAuthenticationFilter.USER_HEADER, userId.toString());
        request.addHeader(GatewayAuthenticationFilter.AUTHORITIES_HEADER, "BILLING_READ,BILLING_WRITE");
        FilterChain chain = mock(FilterChain.class);

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertThat(authentication).isNotNull();
        assertThat(authentication.getName()).isEqualTo(userId.toString());
        assertThat(authentication.getAuthorities()).extracting(GrantedAuthority::getAuthority)
                .containsExactlyInAnyOrder("BILLING_READ", "BILLING_WRITE");
        verify(chain).doFilter(eq(request), any());
    }

    @Test
    @DisplayName("a malformed user header leaves the request anonymous")
    void malformed() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/cost/summary");
        request.addHeader(GatewayAuthenticationFilter.USER_HEADER, "not-a-uuid");
        FilterChain chain = mock(FilterChain.class);

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }

    @Test
    @DisplayName("a user without authorities header gets none")
    void noAuthorities() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/cost/summary");
        request.addHeader(GatewayAuthenticationFilter.USER_HEADER, UUID.randomUUID().toString());

        filter.doFilter(request, new MockHttpServletResponse(), mock(FilterChain.class));

        assertThat(SecurityContextHolder.getContext().getAuthentication().getAuthorities()).isEmpty();
    }
}
