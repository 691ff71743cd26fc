package com.skinbroker.queue;

import com.skinbroker.config.BrokerProperties;
import com.skinbroker.error.ErrorCode;
import com.skinbroker.events.BrokerEventPublisher;
import com.skinbroker.events.BrokerEventTypes;
import com.skinbroker.support.RetryPolicy;
import com.skinbroker.trade.DispatchResult;
import com.skinbroker.trade.TradeDispatcher;
import com.skinbroker.trade.TradeRequest;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * FIFO dispatch queue drained by one worker thread, so at most one offer is sent per process at a time.
 *
 * <p>Retryable failures go back to {@link JobStatus#FAILED_RETRYABLE} and are re-queued after a capped
 * exponential backoff; terminal or exhausted failures and cancellations are handed to the
 * {@link DispatchOutcomeListener}.
 */
@Slf4j
public class TradeDispatchQueue implements AutoCloseable {

  private static final long POLL_MILLIS = 200;

  private final TradeDispatcher dispatcher;
  private final DispatchOutcomeListener listener;
  private final RetryPolicy retryPolicy;
  private final BrokerEventPublisher events;
  private final Clock clock;

  private final LinkedBlockingDeque<JobHandle> pending = new LinkedBlockingDeque<>();
  private final Map<String, JobHandle> jobsById = new ConcurrentHashMap<>();
  private final ScheduledExecutorService retryExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
    Thread t = new Thread(r, "dispatch-retry");
    t.setDaemon(true);
    return t;
  });

  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean active = new AtomicBoolean(false);
  private final Object pauseLock = new Object();
  private volatile boolean paused;
  private volatile Thread worker;

  private final AtomicInteger delayed = new AtomicInteger(0);
  private final AtomicLong succeeded = new AtomicLong(0);
  private final AtomicLong failed = new AtomicLong(0);
  private final AtomicLong retried = new AtomicLong(0);
  private final AtomicLong cancelled = new AtomicLong(0);

  public TradeDispatchQueue(
      @NonNull TradeDispatcher dispatcher,
      @NonNull DispatchOutcomeListener listener,
      @NonNull BrokerProperties.Queue cfg,
      @NonNull BrokerEventPublisher events,
      @NonNull Clock clock
  ) {
    this.dispatcher = dispatcher;
    this.listener = listener;
    this.retryPolicy = new RetryPolicy(cfg.maxAttempts(), cfg.initialBackoffMillis(), cfg.maxBackoffMillis());
    this.events = events;
    this.clock = clock;
  }

  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    Thread t = new Thread(this::runWorker, "trade-dispatch-worker");
    t.setDaemon(true);
    worker = t;
    t.start();
    log.info("trade dispatch queue started maxAttempts={}", retryPolicy.maxAttempts());
  }

  public void stop() {
    if (!started.compareAndSet(true, false)) {
      return;
    }
    Thread t = worker;
    if (t != null) {
      t.interrupt();
    }
    log.info("trade dispatch queue stopped waiting={}", pending.size());
  }

  @Override
  public void close() {
    stop();
    retryExecutor.shutdownNow();
  }

  public JobHandle enqueue(@NonNull TradeRequest request) {
    JobHandle job = new JobHandle(UUID.randomUUID().toString(), request, clock.instant());
    jobsById.put(job.jobId(), job);
    pending.add(job);
    log.info("trade job enqueued jobId={} tradeId={} leg={} waiting={}", job.jobId(), request.tradeId(), request.leg(), pending.size());
    return job;
  }

  /**
   * Cancels a job that has not started. A job waiting out a retry backoff counts as not started.
   */
  public boolean cancel(String jobId) {
    JobHandle job = jobId == null ? null : jobsById.get(jobId);
    if (job == null) {
      return false;
    }
    boolean wasQueued = job.transition(JobStatus.QUEUED, JobStatus.CANCELLED, clock.instant());
    if (!wasQueued && !job.transition(JobStatus.FAILED_RETRYABLE, JobStatus.CANCELLED, clock.instant())) {
      log.debug("trade job not cancellable jobId={} status={}", jobId, job.status());
      return false;
    }
    pending.remove(job);
    cancelled.incrementAndGet();
    log.info("trade job cancelled jobId={} tradeId={}", jobId, job.tradeId());
    publish(BrokerEventTypes.DISPATCH_JOB_CANCELLED, job, null, null);
    notifyCancelled(job);
    jobsById.remove(jobId);
    return true;
  }

  public Optional<JobHandle> find(String jobId) {
    return Optional.ofNullable(jobId == null ? null : jobsById.get(jobId));
  }

  /**
   * Live jobs of one trade, oldest first. Jobs that reached a final status are no longer listed.
   */
  public List<JobHandle> findByTrade(String tradeId) {
    if (tradeId == null) {
      return List.of();
    }
    return jobsById.values().stream()
        .filter(j -> tradeId.equals(j.tradeId()))
        .sorted(Comparator.comparing(JobHandle::enqueuedAt))
        .toList();
  }

  public void pause() {
    paused = true;
    log.info("trade dispatch queue paused");
  }

  public void resume() {
    synchronized (pauseLock) {
      paused = false;
      pauseLock.notifyAll();
    }
    log.info("trade dispatch queue resumed");
  }

  public boolean isPaused() {
    return paused;
  }

  public QueueStats stats() {
    return new QueueStats(
        pending.size(),
        delayed.get(),
        active.get(),
        paused,
        succeeded.get(),
        failed.get(),
        retried.get(),
        cancelled.get()
    );
  }

  private void runWorker() {
    while (started.get()) {
      JobHandle job;
      try {
        awaitResumed();
        job = pending.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }
      if (job == null) {
        continue;
      }
      if (paused) {
        // paused while blocked in poll
        pending.offerFirst(job);
        continue;
      }
      process(job);
    }
    log.debug("trade dispatch worker exiting");
  }

  private void awaitResumed() throws InterruptedException {
    synchronized (pauseLock) {
      while (paused) {
        pauseLock.wait();
      }
    }
  }

  private void process(JobHandle job) {
    if (!job.transition(JobStatus.QUEUED, JobStatus.PROCESSING, clock.instant())) {
      return;
    }
    active.set(true);
    int attempt = job.beginAttempt();
    try {
      DispatchResult result = dispatcher.dispatchTrade(job.payload());
      job.transition(JobStatus.PROCESSING, JobStatus.SUCCEEDED, clock.instant());
      succeeded.incrementAndGet();
      log.info("trade job succeeded jobId={} tradeId={} attempt={} agent={} offerId={}",
          job.jobId(), job.tradeId(), attempt, result.agentId(), result.offerId());
      publish(BrokerEventTypes.DISPATCH_JOB_SUCCEEDED, job, result, null);
      notifySucceeded(job, result);
      jobsById.remove(job.jobId());
    } catch (RuntimeException e) {
      handleFailure(job, attempt, e);
    } finally {
      active.set(false);
    }
  }

  private void handleFailure(JobHandle job, int attempt, RuntimeException e) {
    ErrorCode code = DispatchErrorClassifier.codeOf(e);
    boolean retryable = DispatchErrorClassifier.isRetryable(e);
    job.recordError(code, e.getMessage());

    if (retryable && retryPolicy.canRetry(attempt)) {
      long delay = RetryPolicy.jitter(retryPolicy.computeDelayMillis(attempt));
      job.transition(JobStatus.PROCESSING, JobStatus.FAILED_RETRYABLE, clock.instant());
      retried.incrementAndGet();
      log.warn("trade job failed, retrying jobId={} tradeId={} attempt={} maxAttempts={} delayMs={} code={} error={}",
          job.jobId(), job.tradeId(), attempt, retryPolicy.maxAttempts(), delay, code, e.getMessage());
      scheduleRetry(job, delay);
      return;
    }

    job.transition(JobStatus.PROCESSING, JobStatus.FAILED_TERMINAL, clock.instant());
    failed.incrementAndGet();
    log.error("trade job failed jobId={} tradeId={} attempts={} retryable={} code={} error={}",
        job.jobId(), job.tradeId(), attempt, retryable, code, e.getMessage());
    publish(BrokerEventTypes.DISPATCH_JOB_FAILED, job, null, code);
    notifyFailed(job, code, e.getMessage());
    jobsById.remove(job.jobId());
  }

  private void scheduleRetry(JobHandle job, long delayMillis) {
    delayed.incrementAndGet();
    try {
      retryExecutor.schedule(() -> {
        delayed.decrementAndGet();
        if (job.transition(JobStatus.FAILED_RETRYABLE, JobStatus.QUEUED, clock.instant())) {
          pending.add(job);
        }
      }, delayMillis, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      delayed.decrementAndGet();
      log.warn("trade dispatch queue shutting down, retry dropped jobId={} tradeId={}", job.jobId(), job.tradeId());
    }
  }

  private void notifySucceeded(JobHandle job, DispatchResult result) {
    try {
      listener.onDispatchSucceeded(job, result);
    } catch (RuntimeException e) {
      log.error("dispatch outcome listener failed jobId={} tradeId={} error={}", job.jobId(), job.tradeId(), e.toString(), e);
    }
  }

  private void notifyFailed(JobHandle job, ErrorCode code, String message) {
    try {
      listener.onDispatchFailed(job, code, message);
    } catch (RuntimeException e) {
      log.error("dispatch outcome listener failed jobId={} tradeId={} error={}", job.jobId(), job.tradeId(), e.toString(), e);
    }
  }

  private void notifyCancelled(JobHandle job) {
    try {
      listener.onDispatchCancelled(job);
    } catch (RuntimeException e) {
      log.error("dispatch outcome listener failed jobId={} tradeId={} error={}", job.jobId(), job.tradeId(), e.toString(), e);
    }
  }

  private void publish(String type, JobHandle job, DispatchResult result, ErrorCode code) {
    if (!events.isEnabled()) {
      return;
    }
    JobOutcomeEvent event = new JobOutcomeEvent(
        job.jobId(),
        job.tradeId(),
        job.payload().leg(),
        job.status(),
        job.attempts(),
        result == null ? null : result.agentId(),
        result == null ? null : result.offerId(),
        code
    );
    events.publish(clock.instant(), type, job.tradeId(), event);
  }
}
