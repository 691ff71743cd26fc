package com.skinbroker.broker.web;

import com.skinbroker.queue.JobHandle;
import com.skinbroker.queue.JobStatus;
import com.skinbroker.queue.QueueStats;
import com.skinbroker.queue.TradeDispatchQueue;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/queue")
@RequiredArgsConstructor
public class QueueController {

  private final @NonNull TradeDispatchQueue queue;

  @GetMapping
  public ResponseEntity<QueueStats> stats() {
    return ResponseEntity.ok(queue.stats());
  }

  @PostMapping("/pause")
  public ResponseEntity<QueueStats> pause() {
    queue.pause();
    return ResponseEntity.ok(queue.stats());
  }

  @PostMapping("/resume")
  public ResponseEntity<QueueStats> resume() {
    queue.resume();
    return ResponseEntity.ok(queue.stats());
  }

  @GetMapping("/jobs")
  public ResponseEntity<List<JobView>> jobsOfTrade(@RequestParam String tradeId) {
    return ResponseEntity.ok(queue.findByTrade(tradeId).stream().map(QueueController::view).toList());
  }

  @GetMapping("/jobs/{jobId}")
  public ResponseEntity<JobView> job(@PathVariable String jobId) {
    return ResponseEntity.of(queue.find(jobId).map(QueueController::view));
  }

  @DeleteMapping("/jobs/{jobId}")
  public ResponseEntity<Void> cancel(@PathVariable String jobId) {
    if (queue.cancel(jobId)) {
      return ResponseEntity.noContent().build();
    }
    return queue.find(jobId).isPresent()
        ? ResponseEntity.status(HttpStatus.CONFLICT).build()
        : ResponseEntity.notFound().build();
  }

  private static JobView view(JobHandle j) {
    return new JobView(j.jobId(), j.tradeId(), j.payload().leg().name(), j.status(), j.attempts(),
        j.lastErrorCode() == null ? null : j.lastErrorCode().name());
  }

  public record JobView(String jobId, String tradeId, String leg, JobStatus status, int attempts, String lastErrorCode) {
  }
}
