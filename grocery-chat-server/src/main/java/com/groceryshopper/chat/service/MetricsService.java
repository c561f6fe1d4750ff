package com.groceryshopper.chat.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Log-based metrics: in-memory counters and gauges, written to the debug log.
 */
@Service
@Slf4j
public class MetricsService {

    private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> gauges = new ConcurrentHashMap<>();

    // ===== Primitives =====

    public void incrementCounter(String name) {
        long count = counters.computeIfAbsent(name, k -> new AtomicLong(0)).incrementAndGet();
        log.debug("[METRIC] Counter: {} = {}", name, count);
    }

    public void incrementGauge(String name) {
        int value = gauges.computeIfAbsent(name, k -> new AtomicInteger(0)).incrementAndGet();
        log.debug("[METRIC] Gauge: {} = {}", name, value);
    }

    public void decrementGauge(String name) {
        int value = gauges.computeIfAbsent(name, k -> new AtomicInteger(0)).decrementAndGet();
        log.debug("[METRIC] Gauge: {} = {}", name, value);
    }

    public void recordTimer(String name, Duration duration) {
        log.debug("[METRIC] Timer: {} = {}ms", name, duration.toMillis());
    }

    // ===== Business Metrics =====

    public void recordConnectionOpened(Long roomId) {
        incrementCounter("websocket.connections");
        incrementGauge("active_connections");
        log.debug("WebSocket subscribed: roomId={}", roomId);
    }

    public void recordConnectionClosed(Long roomId) {
        incrementCounter("websocket.disconnections");
        decrementGauge("active_connections");
        log.debug("WebSocket unsubscribed: roomId={}", roomId);
    }

    public void recordBroadcast(Long roomId, int delivered, int dropped) {
        incrementCounter("broadcast.sent");
        counters.computeIfAbsent("broadcast.deliveries", k -> new AtomicLong(0)).addAndGet(delivered);
        if (dropped > 0) {
            counters.computeIfAbsent("broadcast.dropped", k -> new AtomicLong(0)).addAndGet(dropped);
        }
        log.debug("Broadcast: roomId={}, delivered={}, dropped={}", roomId, delivered, dropped);
    }

    public void recordPipelineRun(String command, Duration duration, boolean success) {
        incrementCounter("pipeline." + command + (success ? ".success" : ".failure"));
        recordTimer("pipeline." + command + ".duration", duration);
    }

    public void recordGenerationCall(String backend, boolean success) {
        incrementCounter("generation." + backend + (success ? ".success" : ".failure"));
    }

    public void recordError(String errorType, String component) {
        incrementCounter("errors");
        log.debug("Error recorded: type={}, component={}", errorType, component);
    }

    // ===== Utility Methods =====

    public long getCounterValue(String name) {
        AtomicLong counter = counters.get(name);
        return counter != null ? counter.get() : 0;
    }

    public int getGaugeValue(String name) {
        AtomicInteger gauge = gauges.get(name);
        return gauge != null ? gauge.get() : 0;
    }
}
