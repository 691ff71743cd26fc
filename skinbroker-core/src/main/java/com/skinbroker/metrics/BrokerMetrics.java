package com.skinbroker.metrics;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Supplier;

/**
 * Thin helper over the {@link MeterRegistry} for broker components.
 * Components expose plain counters and snapshots; this class turns them into meters.
 * Suppliers are held strongly, so callers can pass lambdas.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BrokerMetrics {

    private final MeterRegistry registry;

    /**
     * Register a gauge that tracks an integer value supplier.
     */
    public void registerIntGauge(String name, String description, Supplier<Integer> valueSupplier, Tag... tags) {
        Gauge.builder(name, valueSupplier, supplier -> {
            Integer value = supplier.get();
            return value != null ? value.doubleValue() : 0.0;
        })
                .description(description)
                .tags(List.of(tags))
                .strongReference(true)
                .register(registry);
        log.debug("registered gauge name={}", name);
    }

    /**
     * Register a gauge that tracks a boolean value (1 = true, 0 = false).
     */
    public void registerBooleanGauge(String name, String description, Supplier<Boolean> valueSupplier, Tag... tags) {
        Gauge.builder(name, valueSupplier, supplier -> {
            Boolean value = supplier.get();
            return Boolean.TRUE.equals(value) ? 1.0 : 0.0;
        })
                .description(description)
                .tags(List.of(tags))
                .strongReference(true)
                .register(registry);
        log.debug("registered boolean gauge name={}", name);
    }

    /**
     * Register a counter whose value is read from a monotonic supplier owned by the component.
     */
    public void registerFunctionCounter(String name, String description, Supplier<Long> valueSupplier, Tag... tags) {
        FunctionCounter.builder(name, valueSupplier, supplier -> {
            Long value = supplier.get();
            return value != null ? value.doubleValue() : 0.0;
        })
                .description(description)
                .tags(List.of(tags))
                .strongReference(true)
                .register(registry);
        log.debug("registered function counter name={}", name);
    }
}
