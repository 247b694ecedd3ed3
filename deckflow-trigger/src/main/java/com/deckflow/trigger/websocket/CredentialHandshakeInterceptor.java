package com.deckflow.trigger.websocket;

import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.Map;

/**
 * 握手阶段提取凭证：优先 Authorization 头，其次 token / accessToken 查询参数。
 * 凭证的校验放在连接建立之后，以便通过 error 信封告知客户端。
 */
@Component
public class CredentialHandshakeInterceptor implements HandshakeInterceptor {

    public static final String CREDENTIAL_ATTRIBUTE = "deckflow.credential";

    @Override
    public boolean beforeHandshake(ServerHttpRequest request,
                                   ServerHttpResponse response,
                                   WebSocketHandler wsHandler,
                                   Map<String, Object> attributes) {
        String credential = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (StringUtils.isBlank(credential)) {
            Map<String, List<String>> params = UriComponentsBuilder.fromUri(request.getURI())
                    .build()
                    .getQueryParams();
            credential = firstParam(params, "token");
            if (StringUtils.isBlank(credential)) {
                credential = firstParam(params, "accessToken");
            }
        }
        if (StringUtils.isNotBlank(credential)) {
            attributes.put(CREDENTIAL_ATTRIBUTE, credential.trim());
        }
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request,
                               ServerHttpResponse response,
                               WebSocketHandler wsHandler,
                               Exception exception) {
    }

    private String firstParam(Map<String, List<String>> params, String name) {
        List<String> values = params.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
