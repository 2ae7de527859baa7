package com.quantdesk.backend.service;

import com.quantdesk.backend.compute.pipeline.IndicatorOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private Counter dependencyCyclesCounter;
    private Timer passDurationTimer;

    @jakarta.annotation.PostConstruct
    void init() {
        dependencyCyclesCounter = Counter.builder("indicator_dependency_cycles_total").register(meterRegistry);
        passDurationTimer = Timer.builder("indicator_pass_duration").register(meterRegistry);
    }

    public void recordIndicatorOutcome(IndicatorOutcome.Status status) {
        if (status == null) {
            return;
        }
        Counter.builder("indicator_applications_total")
                .tag("outcome", status.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
    }

    public void recordDependencyCycles(int cycles) {
        if (cycles <= 0) {
            return;
        }
        if (dependencyCyclesCounter != null) {
            dependencyCyclesCounter.increment(cycles);
        }
    }

    public void recordPassDuration(long nanos) {
        if (passDurationTimer != null) {
            passDurationTimer.record(nanos, TimeUnit.NANOSECONDS);
        }
    }
}
