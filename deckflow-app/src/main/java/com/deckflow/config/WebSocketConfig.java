package com.deckflow.config;

import com.deckflow.trigger.websocket.CredentialHandshakeInterceptor;
import com.deckflow.trigger.websocket.DirectorWebSocketHandler;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * WebSocket 端点配置。
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final DirectorWebSocketHandler directorWebSocketHandler;
    private final CredentialHandshakeInterceptor credentialHandshakeInterceptor;
    private final String path;
    private final String[] allowedOrigins;

    public WebSocketConfig(DirectorWebSocketHandler directorWebSocketHandler,
                           CredentialHandshakeInterceptor credentialHandshakeInterceptor,
                           @Value("${connection.websocket.path:/ws/director}") String path,
                           @Value("${connection.websocket.allowed-origins:*}") String allowedOrigins) {
        this.directorWebSocketHandler = directorWebSocketHandler;
        this.credentialHandshakeInterceptor = credentialHandshakeInterceptor;
        this.path = StringUtils.defaultIfBlank(path, "/ws/director");
        this.allowedOrigins = StringUtils.split(StringUtils.defaultIfBlank(allowedOrigins, "*"), ',');
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(directorWebSocketHandler, path)
                .addInterceptors(credentialHandshakeInterceptor)
                .setAllowedOriginPatterns(allowedOrigins);
    }

    /**
     * 放宽文本帧缓冲，容纳多字节字符的长请求。
     */
    @Bean
    public ServletServerContainerFactoryBean webSocketContainer(
            @Value("${connection.websocket.max-text-message-bytes:65536}") int maxTextMessageBytes) {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(Math.max(maxTextMessageBytes, 8192));
        return container;
    }
}
