package uk.gegc.costcentre.shared.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Trusts the identity headers set by the upstream gateway that performs authentication.
 *
 * <p>The user header must carry the user UUID; authorities are a comma separated list.
 * Requests without a well-formed user header stay anonymous.
 */
@Slf4j
public class GatewayAuthenticationFilter extends OncePerRequestFilter {

    public static final String USER_HEADER = "X-Authenticated-User";
    public static final String AUTHORITIES_HEADER = "X-Authenticated-Authorities";

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String userHeader = request.getHeader(USER_HEADER);

        if (StringUtils.hasText(userHeader)) {
            try {
                UUID userId = UUID.fromString(userHeader.trim());
                String authorities = request.getHeader(AUTHORITIES_HEADER);
                UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                        userId.toString(),
                        null,
                        AuthorityUtils.commaSeparatedStringToAuthorityList(authorities != null ? authorities : "")
                );
                SecurityContextHolder.getContext().setAuthentication(authentication);
                log.debug("Authenticated gateway user: {}", userId);
            } catch (IllegalArgumentException e) {
                log.warn("Malformed {} header received, URI: {}", USER_HEADER, request.getRequestURI());
            }
        }

        filterChain.doFilter(request, response);
    }
}
