package com.dealtracker.poller.application.websocket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.BDDMockito.then;
import static org.mockito.BDDMockito.willAnswer;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;

import com.dealtracker.common.json.JacksonConfig;
import com.dealtracker.poller.application.config.DealPollerProperties;
import com.dealtracker.poller.domain.notification.LiveConnectionRegistry;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

@ExtendWith(MockitoExtension.class)
class LiveDealsWebSocketHandlerTest {

    @Mock
    private WebSocketSession session;

    private LiveConnectionRegistry registry;
    private ThreadPoolTaskExecutor sendExecutor;
    private LiveDealsWebSocketHandler handler;

    @BeforeEach
    void setUp() throws Exception {
        lenient().when(session.getId()).thenReturn("session-1");
        lenient().when(session.isOpen()).thenReturn(true);
        registry = new LiveConnectionRegistry();
        sendExecutor = new ThreadPoolTaskExecutor();
        sendExecutor.setCorePoolSize(2);
        sendExecutor.initialize();
        handler = new LiveDealsWebSocketHandler(
                JacksonConfig.createObjectMapper(), registry, sendExecutor, properties());
    }

    @AfterEach
    void tearDown() {
        registry.closeAll();
        sendExecutor.shutdown();
    }

    @Test
    void shouldRegisterAndForwardBroadcasts() throws Exception {
        // when
        handler.handleTextMessage(session, new TextMessage("{\"action\":\"subscribe\",\"region\":\"Calgary\"}"));
        registry.broadcast("calgary", "{\"type\":\"new_deals\"}");

        // then
        assertThat(registry.connectionCount("calgary")).isEqualTo(1);
        then(session).should(timeout(2000))
                .sendMessage(argThat(message -> message.getPayload().equals("{\"type\":\"new_deals\"}")));
    }

    @Test
    void shouldRejectUnknownRegion() throws Exception {
        // when
        handler.handleTextMessage(session, new TextMessage("{\"action\":\"subscribe\",\"region\":\"atlantis\"}"));

        // then
        assertThat(registry.connectionCount()).isZero();
        then(session).should().sendMessage(argThat(message ->
                message.getPayload().toString().contains("unknown region: atlantis")));
    }

    @Test
    void shouldMoveSubscriptionToNewRegion() throws Exception {
        // when
        handler.handleTextMessage(session, new TextMessage("{\"action\":\"subscribe\",\"region\":\"calgary\"}"));
        handler.handleTextMessage(session, new TextMessage("{\"action\":\"subscribe\",\"region\":\"toronto\"}"));

        // then
        assertThat(registry.connectionCount("calgary")).isZero();
        assertThat(registry.connectionCount("toronto")).isEqualTo(1);
    }

    @Test
    void shouldUnregisterOnClose() throws Exception {
        // given
        handler.handleTextMessage(session, new TextMessage("{\"action\":\"subscribe\",\"region\":\"calgary\"}"));

        // when
        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        // then
        assertThat(registry.connectionCount()).isZero();
    }

    @Test
    void shouldCloseSessionWhenBufferOverflows() throws Exception {
        // given
        var sendBlocked = new CountDownLatch(1);
        willAnswer(invocation -> {
            sendBlocked.await(2, TimeUnit.SECONDS);
            return null;
        }).given(session).sendMessage(any());
        handler.handleTextMessage(session, new TextMessage("{\"action\":\"subscribe\",\"region\":\"calgary\"}"));

        // when
        for (var i = 0; i < 20; i++) {
            registry.broadcast("calgary", "{\"type\":\"new_deals\",\"seq\":" + i + "}");
        }
        sendBlocked.countDown();

        // then
        assertThat(registry.connectionCount("calgary")).isZero();
        then(session).should(timeout(2000))
                .close(argThat(status -> status.getCode() == CloseStatus.POLICY_VIOLATION.getCode()));
    }

    @Test
    void shouldKeepSessionOpenAfterUnsubscribe() throws Exception {
        // given
        handler.handleTextMessage(session, new TextMessage("{\"action\":\"subscribe\",\"region\":\"calgary\"}"));

        // when
        handler.handleTextMessage(session, new TextMessage("{\"action\":\"unsubscribe\"}"));

        // then
        assertThat(registry.connectionCount()).isZero();
        then(session).should(after(300).never()).close(any());
    }

    @Test
    void shouldIgnoreMalformedMessage() throws Exception {
        // when
        handler.handleTextMessage(session, new TextMessage("not json"));

        // then
        assertThat(registry.connectionCount()).isZero();
        then(session).should(never()).sendMessage(any());
    }

    private static DealPollerProperties properties() {
        var retry = new DealPollerProperties.BackoffConfig(1, 1, 1, 1.0);
        var region = new DealPollerProperties.RegionConfig("Calgary", 51.0447, -114.0719, 75000, 50);
        return new DealPollerProperties(
                Duration.ofMinutes(5),
                Duration.ZERO,
                1,
                1,
                new DealPollerProperties.CacheConfig(Duration.ofSeconds(60)),
                new DealPollerProperties.UpstreamConfig(
                        "https://api.example.test", null, Duration.ofSeconds(5), Duration.ofSeconds(30)),
                retry,
                new DealPollerProperties.EmailConfig(5, retry),
                new DealPollerProperties.LiveConfig(8, Duration.ofMillis(50)),
                new DealPollerProperties.HealthConfig(3),
                Map.of("calgary", region, "toronto", region));
    }
}
