package com.deckflow.infrastructure.identity;

import com.deckflow.domain.identity.adapter.gateway.IIdentityGateway;
import com.deckflow.types.enums.ErrorCodeEnum;
import com.deckflow.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于配置的预签发令牌校验（app.auth.tokens: token -> userId）。
 */
@Slf4j
public class ConfiguredTokenIdentityGateway implements IIdentityGateway {

    private static final String BEARER_PREFIX = "Bearer ";

    private final Map<String, String> tokenToUser;

    public ConfiguredTokenIdentityGateway(Map<String, String> tokenToUser) {
        this.tokenToUser = new ConcurrentHashMap<>();
        if (tokenToUser != null) {
            tokenToUser.forEach((token, userId) -> {
                if (StringUtils.isNotBlank(token) && StringUtils.isNotBlank(userId)) {
                    this.tokenToUser.put(token.trim(), userId.trim());
                }
            });
        }
        if (this.tokenToUser.isEmpty()) {
            log.warn("No credentials configured under app.auth.tokens, every connection will be rejected");
        }
    }

    @Override
    public String verify(String credential) {
        String token = parseToken(credential);
        if (StringUtils.isBlank(token)) {
            throw new AppException(ErrorCodeEnum.AUTH_FAILED.getCode(), "credential is missing");
        }
        String userId = tokenToUser.get(token);
        if (userId == null) {
            throw new AppException(ErrorCodeEnum.AUTH_FAILED.getCode(), "credential is invalid or revoked");
        }
        return userId;
    }

    private String parseToken(String credential) {
        String value = StringUtils.trimToNull(credential);
        if (value == null) {
            return null;
        }
        if (value.length() >= BEARER_PREFIX.length()
                && value.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return StringUtils.trimToNull(value.substring(BEARER_PREFIX.length()));
        }
        return value;
    }
}
