package com.comma.counseling.ws;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;

/**
 * Transport adapter for {@code /ws/chat/{sessionId}?token=...}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CounselingWebSocketHandler extends TextWebSocketHandler {

    private final RealtimeSessionCoordinator coordinator;

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        URI uri = session.getUri();
        if (uri == null) {
            coordinator.connect(session, "", null);
            return;
        }
        UriComponents components = UriComponentsBuilder.fromUri(uri).build();
        List<String> segments = components.getPathSegments();
        String sessionId = segments.isEmpty() ? "" : segments.get(segments.size() - 1);
        coordinator.connect(session, sessionId, components.getQueryParams().getFirst("token"));
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        coordinator.handleInbound(session, message.getPayload());
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.warn("Transport error on socket {}: {}", session.getId(), exception.getMessage());
        coordinator.disconnect(session);
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        coordinator.disconnect(session);
    }
}
