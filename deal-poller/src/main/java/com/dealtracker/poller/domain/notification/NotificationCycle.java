package com.dealtracker.poller.domain.notification;

import com.dealtracker.common.event.EmailDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Fan-out state for one polling cycle.
 *
 * <p>{@link #dispatch} pushes live messages immediately and collects matching events per
 * subscriber; {@link #complete} turns each subscriber's collection into a single email. Dispatch is
 * safe to call from concurrent store workers.
 */
@Slf4j
public class NotificationCycle {

    private final String cycleId;
    private final LiveBroadcaster liveBroadcaster;
    private final PreferenceProvider preferenceProvider;
    private final EmailQueue emailQueue;
    private final FanOutSettings settings;
    private final Clock clock;

    private final Map<String, List<SubscriberPreference>> subscribersByRegion = new ConcurrentHashMap<>();
    private final Map<String, PendingDigest> pendingByUser = new ConcurrentHashMap<>();
    private final AtomicInteger liveMessages = new AtomicInteger();
    private final AtomicBoolean completed = new AtomicBoolean();

    NotificationCycle(
            String cycleId,
            LiveBroadcaster liveBroadcaster,
            PreferenceProvider preferenceProvider,
            EmailQueue emailQueue,
            FanOutSettings settings,
            Clock clock) {
        this.cycleId = cycleId;
        this.liveBroadcaster = liveBroadcaster;
        this.preferenceProvider = preferenceProvider;
        this.emailQueue = emailQueue;
        this.settings = settings;
        this.clock = clock;
    }

    public String cycleId() {
        return cycleId;
    }

    public void dispatch(List<NotificationEvent> events, String regionKey) {
        if (completed.get()) {
            throw new IllegalStateException("Notification cycle " + cycleId + " is already complete");
        }
        var regional = events.stream().filter(event -> regionKey.equals(event.regionKey())).toList();
        if (regional.size() != events.size()) {
            log.warn("notify.region_mismatch: cycle_id={}, region={}, ignored={}",
                    cycleId, regionKey, events.size() - regional.size());
        }
        if (regional.isEmpty()) {
            return;
        }
        var now = clock.instant();
        liveMessages.addAndGet(liveBroadcaster.publish(regionKey, regional, now));

        List<SubscriberPreference> subscribers;
        try {
            subscribers = subscribersByRegion.computeIfAbsent(regionKey, preferenceProvider::listSubscribers);
        } catch (RuntimeException e) {
            log.warn("notify.subscribers_unavailable: cycle_id={}, region={}, events={}, error={}",
                    cycleId, regionKey, regional.size(), e.getMessage());
            return;
        }
        for (var subscriber : subscribers) {
            var matching = regional.stream()
                    .filter(event -> PreferenceFilter.matches(subscriber, event, now))
                    .toList();
            if (!matching.isEmpty()) {
                pendingByUser.computeIfAbsent(subscriber.userId(), id -> new PendingDigest(subscriber))
                        .addAll(matching);
            }
        }
    }

    /**
     * Enqueues one email per subscriber that collected anything. An enqueue that still fails after
     * the retry budget is dropped for that subscriber only.
     */
    public FanOutReport complete() {
        if (!completed.compareAndSet(false, true)) {
            throw new IllegalStateException("Notification cycle " + cycleId + " is already complete");
        }
        var enqueued = 0;
        var dropped = 0;
        var createdAt = clock.instant();
        for (var pending : pendingByUser.values()) {
            var digest = pending.toDigest(cycleId, settings.sampleSize(), createdAt);
            try {
                settings.emailRetry().executeRunnable(() -> emailQueue.enqueue(digest.userId(), digest));
                enqueued++;
                log.info("email.enqueued: cycle_id={}, user_id={}, total={}, new={}, price_drops={}",
                        cycleId, digest.userId(), digest.totalCount(), digest.newDealCount(), digest.priceDropCount());
            } catch (RuntimeException e) {
                dropped++;
                log.warn("email.dropped: cycle_id={}, user_id={}, total={}, attempts={}, error={}",
                        cycleId, digest.userId(), digest.totalCount(), settings.emailRetry().getRetryConfig().getMaxAttempts(),
                        e.getMessage());
            }
        }
        return new FanOutReport(liveMessages.get(), enqueued, dropped);
    }

    private static final class PendingDigest {

        private final SubscriberPreference subscriber;
        private final List<NotificationEvent> events = new ArrayList<>();

        private PendingDigest(SubscriberPreference subscriber) {
            this.subscriber = subscriber;
        }

        synchronized void addAll(List<NotificationEvent> matching) {
            events.addAll(matching);
        }

        synchronized EmailDigest toDigest(String cycleId, int sampleSize, Instant createdAt) {
            var newDeals = (int) events.stream().filter(event -> event.kind() == EventKind.NEW).count();
            return EmailDigest.builder()
                    .userId(subscriber.userId())
                    .email(subscriber.email())
                    .displayName(subscriber.displayName())
                    .region(subscriber.regionKey())
                    .cycleId(cycleId)
                    .totalCount(events.size())
                    .newDealCount(newDeals)
                    .priceDropCount(events.size() - newDeals)
                    .sample(events.stream().limit(sampleSize).map(NotificationEvent::toSummary).toList())
                    .createdAt(createdAt)
                    .build();
        }
    }
}
