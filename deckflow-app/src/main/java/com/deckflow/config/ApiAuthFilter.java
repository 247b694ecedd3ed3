package com.deckflow.config;

import com.deckflow.api.response.Response;
import com.deckflow.domain.identity.adapter.gateway.IIdentityGateway;
import com.deckflow.types.common.Constants;
import com.deckflow.types.enums.ResponseCode;
import com.deckflow.types.exception.AppException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * `/api/**` 统一鉴权过滤器（白名单接口除外）。
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class ApiAuthFilter extends OncePerRequestFilter {

    private static final String API_PREFIX = "/api/";
    private static final String ACCESS_TOKEN_PARAM = "accessToken";
    private static final List<String> WHITELIST_PATTERNS = List.of(
            "/api/health"
    );

    private final ObjectMapper objectMapper;
    private final IIdentityGateway identityGateway;
    private final AntPathMatcher antPathMatcher;

    public ApiAuthFilter(ObjectMapper objectMapper,
                         IIdentityGateway identityGateway) {
        this.objectMapper = objectMapper;
        this.identityGateway = identityGateway;
        this.antPathMatcher = new AntPathMatcher();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (request == null) {
            return true;
        }
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String path = normalizePath(request.getRequestURI());
        if (!path.startsWith(API_PREFIX)) {
            return true;
        }
        for (String pattern : WHITELIST_PATTERNS) {
            if (antPathMatcher.match(pattern, path)) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String path = normalizePath(request.getRequestURI());
        String userId;
        try {
            userId = identityGateway.verify(resolveAuthorization(request));
        } catch (AppException ex) {
            if (log.isDebugEnabled()) {
                log.debug("Auth rejected. method={}, path={}, reason={}", request.getMethod(), path, ex.getInfo());
            }
            writeUnauthorized(response);
            return;
        }
        request.setAttribute(Constants.AUTH_USER_ID_ATTRIBUTE, userId);
        filterChain.doFilter(request, response);
    }

    private String resolveAuthorization(HttpServletRequest request) {
        String authorization = StringUtils.trimToNull(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (StringUtils.isNotBlank(authorization)) {
            return authorization;
        }
        return StringUtils.trimToNull(request.getParameter(ACCESS_TOKEN_PARAM));
    }

    private void writeUnauthorized(HttpServletResponse response) throws IOException {
        Response<Void> body = Response.<Void>builder()
                .code(ResponseCode.UNAUTHORIZED.getCode())
                .info(ResponseCode.UNAUTHORIZED.getInfo())
                .build();
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
        response.getWriter().flush();
    }

    private String normalizePath(String path) {
        if (StringUtils.isBlank(path)) {
            return "/";
        }
        return path.trim();
    }
}
