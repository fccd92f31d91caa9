package com.dealtracker.poller.domain.notification;

import com.dealtracker.common.event.LiveDealMessage;
import com.dealtracker.common.event.LiveMessageType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/**
 * Turns a batch of events into at most one message per live type and pushes them to the region's
 * viewers. Delivery is at most once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LiveBroadcaster {

    private final LiveConnectionRegistry registry;
    private final ObjectMapper objectMapper;

    /** Returns the number of messages built, whether or not anyone was listening. */
    public int publish(String regionKey, List<NotificationEvent> events, Instant now) {
        Map<LiveMessageType, List<NotificationEvent>> byType = new EnumMap<>(LiveMessageType.class);
        for (var event : events) {
            event.kind().liveType().ifPresent(type ->
                    byType.computeIfAbsent(type, key -> new ArrayList<>()).add(event));
        }
        byType.forEach((type, typed) -> {
            var message = LiveDealMessage.of(type, typed.stream().map(NotificationEvent::toSummary).toList(), now);
            var delivered = registry.broadcast(regionKey, objectMapper.writeValueAsString(message));
            log.debug("live.broadcast: region={}, type={}, count={}, delivered={}",
                    regionKey, type.wireName(), typed.size(), delivered);
        });
        return byType.size();
    }
}
