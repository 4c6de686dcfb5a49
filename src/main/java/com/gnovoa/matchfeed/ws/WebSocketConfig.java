package com.gnovoa.matchfeed.ws;

import com.gnovoa.matchfeed.config.FeedProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final MatchSocketHandler handler;
    private final FeedProperties props;

    public WebSocketConfig(MatchSocketHandler handler, FeedProperties props) {
        this.handler = handler;
        this.props = props;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, "/ws/matches/*")
                .addInterceptors(new MatchHandshakeInterceptor())
                .setAllowedOrigins(props.allowedOrigins().split(","));
    }

    /** Container-level frame limit and idle timeout, backing the per-connection checks. */
    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        var container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(props.maxMessageBytes());
        container.setMaxBinaryMessageBufferSize(props.maxMessageBytes());
        container.setMaxSessionIdleTimeout(props.pongWait().toMillis());
        return container;
    }
}
