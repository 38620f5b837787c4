package com.opro.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;

/**
 * Push-only socket: {@code /ws/stream?runId=...&since=<last seen event id>}.
 */
@Component
public class OptimizationStreamWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(OptimizationStreamWebSocketHandler.class);

    public static final String PATH = "/ws/stream";

    private final OptimizationStreamHub hub;

    public OptimizationStreamWebSocketHandler(OptimizationStreamHub hub) {
        this.hub = hub;
    }

    public static String subscriptionPath(String runId) {
        return PATH + "?runId=" + runId;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        URI uri = session.getUri();
        if (uri == null) {
            session.close(CloseStatus.BAD_DATA);
            return;
        }
        var query = UriComponentsBuilder.fromUri(uri).build().getQueryParams();
        String runId = query.getFirst("runId");
        if (!StringUtils.hasText(runId)) {
            session.close(CloseStatus.BAD_DATA);
            return;
        }
        hub.attach(runId, session, parseSince(query.getFirst("since")));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        // server push only
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        hub.detach(session);
    }

    static long parseSince(String value) {
        if (!StringUtils.hasText(value)) {
            return 0L;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            log.debug("Ignoring invalid since parameter {}", value);
            return 0L;
        }
    }
}
