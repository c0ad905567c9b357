package com.surveyindex.backend.config;

import com.surveyindex.backend.websocket.TelemetryHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.*;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final TelemetryHandler telemetryHandler;
    private final SurveyIndexProperties properties;

    public WebSocketConfig(TelemetryHandler telemetryHandler, SurveyIndexProperties properties) {
        this.telemetryHandler = telemetryHandler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(telemetryHandler, properties.getWebsocket().getPath())
                .setAllowedOriginPatterns(properties.getCors().getAllowedOrigins().toArray(new String[0]));
    }
}
