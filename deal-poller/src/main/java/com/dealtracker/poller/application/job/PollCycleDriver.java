package com.dealtracker.poller.application.job;

import com.dealtracker.common.id.UlidGenerator;
import com.dealtracker.poller.application.config.DealPollerProperties;
import com.dealtracker.poller.domain.cycle.CycleReport;
import com.dealtracker.poller.domain.cycle.CycleScope;
import com.dealtracker.poller.domain.cycle.RegionOutcome;
import com.dealtracker.poller.domain.cycle.RegionProcessor;
import com.dealtracker.poller.domain.exceptions.InvalidPollerConfigurationException;
import com.dealtracker.poller.domain.notification.LiveConnectionRegistry;
import com.dealtracker.poller.domain.notification.NotificationFanOut;
import com.dealtracker.poller.domain.region.Region;
import io.micrometer.core.instrument.Counter;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Owns the polling timer. Cycles run with a fixed delay between the end of one and the start of
 * the next; a fire that finds a cycle still running is skipped.
 *
 * <p>Only a schedule that cannot be set up moves the driver to {@link DriverState#FAILED}. Anything
 * that goes wrong inside a cycle is contained to its region or store.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PollCycleDriver {

    private final DealPollerProperties properties;
    private final RegionProcessor regionProcessor;
    private final NotificationFanOut notificationFanOut;
    private final LiveConnectionRegistry connectionRegistry;
    private final ThreadPoolTaskScheduler pollScheduler;
    private final ThreadPoolTaskExecutor regionExecutor;
    private final Clock clock;
    private final Counter cyclesCompletedCounter;
    private final Counter regionsSkippedCounter;
    private final Counter dealEventsCounter;
    private final Counter emailsEnqueuedCounter;
    private final Counter emailsDroppedCounter;

    private final AtomicReference<DriverState> state = new AtomicReference<>(DriverState.IDLE);
    private volatile ScheduledFuture<?> timer;

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (timer != null) {
            return;
        }
        if (state.get() != DriverState.IDLE) {
            throw new IllegalStateException("Poller cannot start from state " + state.get());
        }
        var regions = properties.toRegions();
        try {
            if (regions.isEmpty()) {
                throw InvalidPollerConfigurationException.of("no regions configured");
            }
            var interval = properties.interval();
            if (interval == null || interval.isZero() || interval.isNegative()) {
                throw InvalidPollerConfigurationException.of("interval must be positive, was " + interval);
            }
            try {
                timer = pollScheduler.scheduleWithFixedDelay(
                        this::runScheduledCycle, clock.instant().plus(properties.initialDelay()), interval);
            } catch (TaskRejectedException e) {
                throw InvalidPollerConfigurationException.of("poll timer rejected", e);
            }
        } catch (InvalidPollerConfigurationException e) {
            state.set(DriverState.FAILED);
            log.error("poller.failed: reason={}", e.getMessage());
            throw e;
        }
        log.info("poller.started: regions={}, interval={}, initial_delay={}",
                regions.stream().map(Region::key).toList(), properties.interval(), properties.initialDelay());
    }

    /**
     * Runs one cycle now on the calling thread. Empty when another cycle is in progress or the
     * driver is no longer accepting cycles.
     */
    public Optional<CycleReport> runCycle() {
        if (!state.compareAndSet(DriverState.IDLE, DriverState.RUNNING)) {
            log.warn("cycle.skipped: state={}", state.get());
            return Optional.empty();
        }
        try {
            return Optional.of(executeCycle());
        } finally {
            state.compareAndSet(DriverState.RUNNING, DriverState.IDLE);
        }
    }

    @PreDestroy
    public void stop() {
        var previous = state.getAndSet(DriverState.STOPPED);
        var scheduled = timer;
        if (scheduled != null) {
            scheduled.cancel(true);
        }
        connectionRegistry.closeAll();
        log.info("poller.stopped: previous_state={}", previous);
    }

    public DriverState state() {
        return state.get();
    }

    private void runScheduledCycle() {
        try {
            runCycle();
        } catch (RuntimeException e) {
            log.error("cycle.crashed: error={}", e.getMessage(), e);
        }
    }

    private CycleReport executeCycle() {
        var cycleId = UlidGenerator.generate();
        var startedAt = clock.instant();
        var regions = properties.toRegions();
        log.info("cycle.started: cycle_id={}, regions={}", cycleId, regions.size());

        var notifications = notificationFanOut.openCycle(cycleId);
        var scope = CycleScope.open(cycleId, startedAt, notifications);

        List<CompletableFuture<RegionOutcome>> futures = new ArrayList<>();
        for (var region : regions) {
            futures.add(regionExecutor.submitCompletable(() -> regionProcessor.process(region, scope)));
        }

        List<RegionOutcome> outcomes = new ArrayList<>();
        for (var i = 0; i < futures.size(); i++) {
            var region = regions.get(i);
            try {
                outcomes.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(future -> future.cancel(true));
                log.warn("cycle.interrupted: cycle_id={}, region={}", cycleId, region.key());
                outcomes.add(RegionOutcome.skipped(region.key(), 0, 0, "interrupted"));
                break;
            } catch (ExecutionException e) {
                log.error("region.crashed: cycle_id={}, region={}, error={}",
                        cycleId, region.key(), e.getCause().getMessage(), e.getCause());
                outcomes.add(RegionOutcome.skipped(region.key(), 0, 0, e.getCause().getMessage()));
            }
        }

        var fanOut = notifications.complete();
        var report = new CycleReport(cycleId, startedAt, clock.instant(), List.copyOf(outcomes), fanOut);

        cyclesCompletedCounter.increment();
        regionsSkippedCounter.increment(report.regionsSkipped());
        dealEventsCounter.increment(report.eventsDispatched());
        emailsEnqueuedCounter.increment(fanOut.emailsEnqueued());
        emailsDroppedCounter.increment(fanOut.emailsDropped());

        log.info("cycle.completed: cycle_id={}, regions_completed={}, regions_skipped={}, stores={}, events={}, "
                        + "live_messages={}, emails={}, emails_dropped={}, duration_ms={}",
                cycleId, report.regionsCompleted(), report.regionsSkipped(), report.storesProcessed(),
                report.eventsDispatched(), fanOut.liveMessages(), fanOut.emailsEnqueued(), fanOut.emailsDropped(),
                report.duration().toMillis());
        return report;
    }
}
