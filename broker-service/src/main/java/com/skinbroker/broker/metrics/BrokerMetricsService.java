package com.skinbroker.broker.metrics;

import com.skinbroker.agent.AgentPoolManager;
import com.skinbroker.events.BrokerEventPublisher;
import com.skinbroker.events.kafka.KafkaBrokerEventPublisher;
import com.skinbroker.metrics.BrokerMetrics;
import com.skinbroker.queue.TradeDispatchQueue;
import com.skinbroker.ratelimit.RateLimiter;
import com.skinbroker.ratelimit.WindowedRateLimiter;
import io.micrometer.core.instrument.Tag;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Binds pool, queue, rate limiter and event publisher state to meters. Values are read on scrape.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BrokerMetricsService {

    private final BrokerMetrics metrics;
    private final AgentPoolManager pool;
    private final TradeDispatchQueue queue;
    private final RateLimiter rateLimiter;
    private final BrokerEventPublisher events;

    @PostConstruct
    public void initializeMetrics() {
        log.info("initializing broker metrics");

        // Pool
        metrics.registerIntGauge("skinbroker_agents", "Registered agents",
                () -> pool.statistics().total(), Tag.of("state", "total"));
        metrics.registerIntGauge("skinbroker_agents", "Registered agents",
                () -> pool.statistics().online(), Tag.of("state", "online"));
        metrics.registerIntGauge("skinbroker_agents", "Registered agents",
                () -> pool.statistics().ready(), Tag.of("state", "ready"));
        metrics.registerIntGauge("skinbroker_agent_active_trades", "Offers currently in flight across agents",
                () -> pool.statistics().activeTrades());
        metrics.registerBooleanGauge("skinbroker_pool_running", "Agent pool started",
                pool::isRunning);

        // Queue
        metrics.registerIntGauge("skinbroker_queue_waiting", "Jobs waiting for the dispatch worker",
                () -> queue.stats().waiting());
        metrics.registerIntGauge("skinbroker_queue_delayed", "Jobs waiting out a retry backoff",
                () -> queue.stats().delayed());
        metrics.registerBooleanGauge("skinbroker_queue_paused", "Dispatch queue paused",
                queue::isPaused);
        metrics.registerFunctionCounter("skinbroker_jobs_total", "Dispatch job outcomes",
                () -> queue.stats().succeeded(), Tag.of("outcome", "succeeded"));
        metrics.registerFunctionCounter("skinbroker_jobs_total", "Dispatch job outcomes",
                () -> queue.stats().failed(), Tag.of("outcome", "failed"));
        metrics.registerFunctionCounter("skinbroker_jobs_total", "Dispatch job outcomes",
                () -> queue.stats().retried(), Tag.of("outcome", "retried"));
        metrics.registerFunctionCounter("skinbroker_jobs_total", "Dispatch job outcomes",
                () -> queue.stats().cancelled(), Tag.of("outcome", "cancelled"));

        // Rate limiter
        if (rateLimiter instanceof WindowedRateLimiter windowed) {
            metrics.registerFunctionCounter("skinbroker_rate_limit_waits_total", "Requests that waited for the next window",
                    windowed::throttledCount);
            metrics.registerFunctionCounter("skinbroker_rate_limit_fail_open_total", "Requests admitted without a rate limit check",
                    windowed::failOpenCount);
        }

        // Events
        if (events instanceof KafkaBrokerEventPublisher kafka) {
            metrics.registerFunctionCounter("skinbroker_events_total", "Broker events sent to Kafka",
                    kafka::publishedCount, Tag.of("outcome", "published"));
            metrics.registerFunctionCounter("skinbroker_events_total", "Broker events sent to Kafka",
                    kafka::failedCount, Tag.of("outcome", "failed"));
        }

        log.info("broker metrics initialized");
    }
}
