package com.skinbroker.ratelimit;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.skinbroker.config.BrokerProperties;
import com.skinbroker.error.RateLimitUnavailableException;
import com.skinbroker.support.MutableClock;
import com.skinbroker.support.Sleeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WindowedRateLimiterTest {

  private final InMemoryRateWindowStore store = new InMemoryRateWindowStore();
  private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
  private final Logger limiterLog = (Logger) LoggerFactory.getLogger(WindowedRateLimiter.class);

  @BeforeEach
  void attachAppender() {
    appender.start();
    limiterLog.addAppender(appender);
  }

  @AfterEach
  void detachAppender() {
    limiterLog.detachAppender(appender);
  }

  @Test
  void admitsUpToMaxWithoutWaitingThenSuspendsPastNextWindow() {
    Clock clock = Clock.fixed(Instant.ofEpochMilli(10_000), ZoneOffset.UTC);
    WindowedRateLimiter limiter = new WindowedRateLimiter(store, config(5, 1_000, BrokerProperties.FailMode.OPEN), clock, Sleeper.system());

    long start = System.nanoTime();
    for (int i = 0; i < 5; i++) {
      limiter.waitForSlot();
    }
    long firstFiveMillis = (System.nanoTime() - start) / 1_000_000;

    long sixthStart = System.nanoTime();
    limiter.waitForSlot();
    long sixthMillis = (System.nanoTime() - sixthStart) / 1_000_000;

    assertThat(firstFiveMillis).isLessThan(100);
    assertThat(sixthMillis).isGreaterThanOrEqualTo(1_000);
    assertThat(limiter.throttledCount()).isEqualTo(1);
  }

  @Test
  void waitsUntilBoundaryPlusGraceAndChargesNextWindow() {
    MutableClock clock = new MutableClock(10_250);
    List<Long> sleeps = new ArrayList<>();
    WindowedRateLimiter limiter = new WindowedRateLimiter(store, config(2, 1_000, BrokerProperties.FailMode.OPEN), clock, millis -> {
      sleeps.add(millis);
      clock.advance(millis);
      return true;
    });

    limiter.waitForSlot();
    limiter.waitForSlot();
    limiter.waitForSlot();

    assertThat(sleeps).containsExactly(750L + 1_000L);
    assertThat(store.count(limiter.windowKey(10))).isEqualTo(3);
    assertThat(store.count(limiter.windowKey(11))).isEqualTo(1);
  }

  @Test
  void neverAdmitsMoreThanMaxPerWindowWithoutWaiting() {
    MutableClock clock = new MutableClock(0);
    List<Long> sleeps = new ArrayList<>();
    WindowedRateLimiter limiter = new WindowedRateLimiter(store, config(3, 1_000, BrokerProperties.FailMode.OPEN), clock, millis -> {
      sleeps.add(millis);
      return true;
    });

    for (int i = 0; i < 7; i++) {
      limiter.waitForSlot();
    }

    assertThat(sleeps).hasSize(4);
    assertThat(limiter.throttledCount()).isEqualTo(4);
  }

  @Test
  void warnsWhenWindowSaturates() {
    Clock clock = Clock.fixed(Instant.ofEpochMilli(0), ZoneOffset.UTC);
    WindowedRateLimiter limiter = new WindowedRateLimiter(store, config(2, 60_000, BrokerProperties.FailMode.OPEN), clock, millis -> true);

    limiter.waitForSlot();
    assertThat(warnings()).isEmpty();

    limiter.waitForSlot();
    assertThat(warnings()).anyMatch(m -> m.contains("window saturated"));
  }

  @Test
  void failsOpenWithWarningWhenStoreNotReady() {
    store.ready = false;
    List<Long> sleeps = new ArrayList<>();
    WindowedRateLimiter limiter = new WindowedRateLimiter(store, config(1, 1_000, BrokerProperties.FailMode.OPEN), Clock.systemUTC(), millis -> {
      sleeps.add(millis);
      return true;
    });

    for (int i = 0; i < 3; i++) {
      limiter.waitForSlot();
    }

    assertThat(sleeps).isEmpty();
    assertThat(store.counters).isEmpty();
    assertThat(limiter.failOpenCount()).isEqualTo(3);
    assertThat(warnings()).hasSize(3).allMatch(m -> m.contains("store not ready") && m.contains("proceeding without rate limit check"));
  }

  @Test
  void failsOpenWhenIncrementThrows() {
    store.failure = new IllegalStateException("connection reset");
    WindowedRateLimiter limiter = new WindowedRateLimiter(store, config(1, 1_000, BrokerProperties.FailMode.OPEN), Clock.systemUTC(), millis -> true);

    limiter.waitForSlot();

    assertThat(limiter.failOpenCount()).isEqualTo(1);
    assertThat(warnings()).singleElement().satisfies(m -> assertThat(m).contains("increment failed").contains("connection reset"));
  }

  @Test
  void failsClosedWithRetryableError() {
    store.ready = false;
    WindowedRateLimiter limiter = new WindowedRateLimiter(store, config(5, 1_000, BrokerProperties.FailMode.CLOSED), Clock.systemUTC(), millis -> true);

    assertThatThrownBy(limiter::waitForSlot)
        .isInstanceOfSatisfying(RateLimitUnavailableException.class, e -> assertThat(e.retryable()).isTrue());
    assertThat(limiter.failOpenCount()).isZero();
  }

  @Test
  void interruptedWaitIsReportedAsUnavailable() {
    Clock clock = Clock.fixed(Instant.ofEpochMilli(0), ZoneOffset.UTC);
    WindowedRateLimiter limiter = new WindowedRateLimiter(store, config(1, 1_000, BrokerProperties.FailMode.OPEN), clock, millis -> false);

    limiter.waitForSlot();

    assertThatThrownBy(limiter::waitForSlot).isInstanceOf(RateLimitUnavailableException.class);
  }

  @Test
  void keysFollowPrefixAndBucket() {
    WindowedRateLimiter limiter = new WindowedRateLimiter(store, config(5, 60_000, BrokerProperties.FailMode.OPEN), Clock.systemUTC(), millis -> true);

    assertThat(limiter.windowKey(28_000_000L)).isEqualTo("steam:ratelimit:28000000");
  }

  private List<String> warnings() {
    return appender.list.stream()
        .filter(e -> e.getLevel() == Level.WARN)
        .map(ILoggingEvent::getFormattedMessage)
        .toList();
  }

  private static BrokerProperties.RateLimit config(int max, long windowMillis, BrokerProperties.FailMode failMode) {
    return new BrokerProperties.RateLimit(true, max, windowMillis, null, null, null, failMode);
  }
}
