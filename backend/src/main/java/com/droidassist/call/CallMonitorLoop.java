package com.droidassist.call;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Polls the call state at a fixed delay and answers incoming calls.
 *
 * <p>Each tick samples the state once. A change from the previous tick is
 * published as a {@link CallEvent}; an IDLE to RINGING change hands the call
 * to the {@link ResponseSequencer} on the dispatch executor, provided the
 * cooldown has elapsed since the last dispatch. The cooldown clock restarts
 * at dispatch, not at completion, and is the only guard against overlapping
 * runs: two rising edges within one poll interval could in theory race, which
 * the cooldown being many intervals long makes harmless.</p>
 *
 * <p>An IDLE to off-hook change with no ringing in between may be an incoming
 * call whose ringing fell between two polls. It is counted and logged but not
 * answered, since the user's own outgoing calls look the same.</p>
 *
 * <p>{@link #stop()} cancels future ticks only. A tick already running and any
 * dispatched sequence finish normally, so a hang-up in progress is never cut off.</p>
 *
 * <p>Ticks run on a single scheduler thread; no exception escapes a tick.</p>
 */
@Slf4j
public class CallMonitorLoop {

    private final StateSampler sampler;
    private final ResponseSequencer sequencer;
    private final CallEventListener listener;
    private final ScheduledExecutorService scheduler;
    private final Executor dispatchExecutor;
    private final Ticker ticker;
    private final Duration pollInterval;
    private final Duration cooldown;

    private final AtomicLong dispatchCount = new AtomicLong();
    private final AtomicLong missedRingCount = new AtomicLong();

    private volatile CallState lastState = CallState.IDLE;
    private volatile CallEvent lastEvent;
    private boolean dispatched;
    private boolean sampledBefore;
    private long lastActionNanos;
    private ScheduledFuture<?> task;

    public CallMonitorLoop(StateSampler sampler,
                           ResponseSequencer sequencer,
                           CallEventListener listener,
                           ScheduledExecutorService scheduler,
                           Executor dispatchExecutor,
                           Ticker ticker,
                           Duration pollInterval,
                           Duration cooldown) {
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("Poll interval must be positive: " + pollInterval);
        }
        this.sampler = sampler;
        this.sequencer = sequencer;
        this.listener = listener;
        this.scheduler = scheduler;
        this.dispatchExecutor = dispatchExecutor;
        this.ticker = ticker;
        this.pollInterval = pollInterval;
        this.cooldown = cooldown;
    }

    /**
     * Starts polling. Returns false when already running.
     */
    public synchronized boolean start() {
        if (isRunning()) {
            return false;
        }
        task = scheduler.scheduleWithFixedDelay(this::safeTick, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Call monitor started (poll every {} ms, cooldown {} ms)", pollInterval.toMillis(), cooldown.toMillis());
        return true;
    }

    /**
     * Stops scheduling new polls. Returns false when not running.
     */
    public synchronized boolean stop() {
        if (!isRunning()) {
            return false;
        }
        task.cancel(false);
        task = null;
        log.info("Call monitor stopped after {} dispatches", dispatchCount.get());
        return true;
    }

    public synchronized boolean isRunning() {
        return task != null && !task.isDone();
    }

    public CallState getLastState() {
        return lastState;
    }

    public CallEvent getLastEvent() {
        return lastEvent;
    }

    public long getDispatchCount() {
        return dispatchCount.get();
    }

    /**
     * Off-hook changes seen straight from IDLE.
     */
    public long getMissedRingCount() {
        return missedRingCount.get();
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public Duration getCooldown() {
        return cooldown;
    }

    void tick() {
        CallState newState = sampleSafely();
        long now = ticker.read();
        CallState previous = lastState;
        if (newState != previous) {
            CallEvent event = new CallEvent(previous, newState, now);
            lastEvent = event;
            log.info("Call state {} -> {}", previous, newState);
            publish(event);
            if (event.isRisingEdge()) {
                onRisingEdge(now);
            } else if (sampledBefore && previous == CallState.IDLE && isOffHook(newState)) {
                missedRingCount.incrementAndGet();
                log.warn("Call went off-hook without ringing being seen, possibly a missed incoming call");
            }
        }
        lastState = newState;
        sampledBefore = true;
    }

    private void onRisingEdge(long now) {
        if (dispatched && now - lastActionNanos <= cooldown.toNanos()) {
            log.info("Incoming call ignored, within {} ms cooldown of the previous response", cooldown.toMillis());
            return;
        }
        dispatched = true;
        lastActionNanos = now;
        try {
            dispatchExecutor.execute(this::runSequence);
            dispatchCount.incrementAndGet();
            log.info("Incoming call detected, response dispatched");
        } catch (RejectedExecutionException e) {
            log.error("Could not dispatch response sequence: {}", e.getMessage());
        }
    }

    private void runSequence() {
        try {
            sequencer.onIncomingCall();
        } catch (Exception e) {
            log.error("Response sequence failed: {}", e.getMessage(), e);
        }
    }

    private static boolean isOffHook(CallState state) {
        return state == CallState.ACTIVE || state == CallState.ANSWERED;
    }

    private CallState sampleSafely() {
        try {
            CallState state = sampler.sample();
            return state == null ? CallState.UNKNOWN : state;
        } catch (Exception e) {
            log.warn("Call state sampling failed: {}", e.getMessage());
            return CallState.UNKNOWN;
        }
    }

    private void publish(CallEvent event) {
        try {
            listener.onCallEvent(event);
        } catch (Exception e) {
            log.warn("Call event listener failed: {}", e.getMessage());
        }
    }

    private void safeTick() {
        try {
            tick();
        } catch (Exception e) {
            log.error("Call monitor tick failed: {}", e.getMessage(), e);
        }
    }
}
