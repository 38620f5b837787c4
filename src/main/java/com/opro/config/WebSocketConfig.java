package com.opro.config;

import com.opro.stream.OptimizationStreamWebSocketHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Exposes automatic-run progress at {@link OptimizationStreamWebSocketHandler#PATH}. Browser origins are
 * limited by {@code opro.stream.allowed-origins}.
 */
@Configuration
@EnableWebSocket
@Slf4j
public class WebSocketConfig implements WebSocketConfigurer {

    private final OptimizationStreamWebSocketHandler runStreamHandler;
    private final OproProperties.StreamConfig streamConfig;

    public WebSocketConfig(OptimizationStreamWebSocketHandler runStreamHandler, OproProperties properties) {
        this.runStreamHandler = runStreamHandler;
        this.streamConfig = properties.getStream();
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        String[] origins = streamConfig.getAllowedOrigins().toArray(String[]::new);
        log.info("Run stream available at {} for origins {}.", OptimizationStreamWebSocketHandler.PATH, streamConfig.getAllowedOrigins());
        registry.addHandler(runStreamHandler, OptimizationStreamWebSocketHandler.PATH)
                .setAllowedOriginPatterns(origins);
    }
}
