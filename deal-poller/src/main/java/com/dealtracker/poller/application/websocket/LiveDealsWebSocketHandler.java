package com.dealtracker.poller.application.websocket;

import com.dealtracker.poller.application.config.DealPollerProperties;
import com.dealtracker.poller.domain.notification.LiveConnection;
import com.dealtracker.poller.domain.notification.LiveConnectionRegistry;
import com.dealtracker.poller.domain.notification.LiveHandle;
import java.io.IOException;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Live deal feed. A client picks one region with {@code {"action":"subscribe","region":"calgary"}}
 * and leaves it with {@code {"action":"unsubscribe"}}. Each subscription gets its own bounded
 * queue, drained onto the session by a dedicated sender task. A client too slow to keep its queue
 * from overflowing is closed with {@link CloseStatus#POLICY_VIOLATION}.
 */
@Slf4j
@Component
public class LiveDealsWebSocketHandler extends TextWebSocketHandler {

    private final ObjectMapper objectMapper;
    private final LiveConnectionRegistry registry;
    private final ThreadPoolTaskExecutor liveSendExecutor;
    private final DealPollerProperties properties;
    private final Set<String> knownRegions;
    private final Map<String, LiveHandle> handlesBySession = new ConcurrentHashMap<>();

    public LiveDealsWebSocketHandler(
            ObjectMapper objectMapper,
            LiveConnectionRegistry registry,
            ThreadPoolTaskExecutor liveSendExecutor,
            DealPollerProperties properties) {
        this.objectMapper = objectMapper;
        this.registry = registry;
        this.liveSendExecutor = liveSendExecutor;
        this.properties = properties;
        this.knownRegions = properties.regions() == null ? Set.of() : properties.regions().keySet().stream()
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        log.info("Live client connected: {}", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String action;
        String region;
        try {
            var node = objectMapper.readTree(message.getPayload());
            action = node.path("action").asText("");
            region = node.path("region").asText("").toLowerCase(Locale.ROOT);
        } catch (JacksonException e) {
            log.warn("Ignoring malformed message from live client {}: {}", session.getId(), e.getMessage());
            return;
        }

        if ("subscribe".equalsIgnoreCase(action)) {
            if (!knownRegions.contains(region)) {
                sendError(session, "unknown region: " + region);
                return;
            }
            subscribe(session, region);
        } else if ("unsubscribe".equalsIgnoreCase(action)) {
            release(session);
            log.info("Live client {} unsubscribed", session.getId());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        release(session);
        log.info("Live client disconnected: {} ({})", session.getId(), status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        release(session);
        log.warn("Transport error for live client {}: {}", session.getId(), exception.getMessage());
    }

    private void subscribe(WebSocketSession session, String region) {
        release(session);
        var connection = new LiveConnection(session.getId(), properties.live().queueCapacity());
        var handle = registry.register(connection, region);
        handlesBySession.put(session.getId(), handle);
        try {
            liveSendExecutor.execute(() -> drain(session, handle));
        } catch (TaskRejectedException e) {
            log.warn("No sender available for live client {}: {}", session.getId(), e.getMessage());
            release(session);
        }
    }

    private void drain(WebSocketSession session, LiveHandle handle) {
        var connection = handle.connection();
        try {
            while (!connection.isClosed() && session.isOpen()) {
                var payload = connection.poll(properties.live().pollTimeout());
                if (payload != null) {
                    send(session, new TextMessage(payload));
                }
            }
            // the handle is still ours only when the registry dropped the connection
            if (connection.isClosed() && handlesBySession.remove(session.getId(), handle) && session.isOpen()) {
                log.warn("Live client {} fell behind and was dropped; closing session", session.getId());
                session.close(CloseStatus.POLICY_VIOLATION.withReason("live buffer overflow"));
            }
        } catch (IOException e) {
            log.warn("Failed to send to live client {}: {}", session.getId(), e.getMessage());
            handlesBySession.remove(session.getId(), handle);
            registry.unregister(handle);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void release(WebSocketSession session) {
        var handle = handlesBySession.remove(session.getId());
        if (handle != null) {
            registry.unregister(handle);
        }
    }

    private void sendError(WebSocketSession session, String reason) {
        var json = objectMapper.writeValueAsString(Map.of("type", "error", "message", reason));
        try {
            send(session, new TextMessage(json));
        } catch (IOException e) {
            log.warn("Failed to send error to live client {}: {}", session.getId(), e.getMessage());
        }
    }

    private static void send(WebSocketSession session, TextMessage message) throws IOException {
        synchronized (session) {
            if (session.isOpen()) {
                session.sendMessage(message);
            }
        }
    }
}
