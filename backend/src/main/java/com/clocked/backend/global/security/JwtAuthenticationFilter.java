package com.clocked.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.clocked.backend.modules.auth.application.AccessTokenClaims;
import com.clocked.backend.modules.auth.application.TokenAuthority;
import com.clocked.backend.modules.auth.application.TokenVerification;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenAuthority tokenAuthority;
    private final ProblemResponseWriter problemResponseWriter;

    public JwtAuthenticationFilter(TokenAuthority tokenAuthority, ProblemResponseWriter problemResponseWriter) {
        this.tokenAuthority = tokenAuthority;
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length());
            TokenVerification<AccessTokenClaims> verification = tokenAuthority.verifyAccessToken(token);
            if (!verification.isValid()) {
                log.debug("Rejected access token on {}: {}", request.getRequestURI(), verification.failure());
                SecurityContextHolder.clearContext();
                problemResponseWriter.write(request, response, HttpStatus.UNAUTHORIZED, "INVALID_ACCESS_TOKEN",
                        "Invalid or expired access token");
                return;
            }

            AccessTokenClaims claims = verification.claims();
            JwtAuthenticationPrincipal principal = new JwtAuthenticationPrincipal(
                    claims.userId(),
                    claims.email(),
                    claims.handle()
            );
            UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(principal, token, List.of());
            authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authentication);
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getServletPath();
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        if (path.startsWith("/auth/magic-link") || path.equals("/auth/refresh")) {
            return true;
        }
        return path.equals("/ws") || path.startsWith("/health") || path.startsWith("/readyz") || path.startsWith("/actuator");
    }
}
