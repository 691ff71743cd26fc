package com.skinbroker.broker.web;

import com.skinbroker.agent.AgentConfig;
import com.skinbroker.agent.AgentPoolManager;
import com.skinbroker.agent.AgentSnapshot;
import com.skinbroker.agent.PoolStatistics;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/pool")
@Validated
@RequiredArgsConstructor
public class PoolController {

  private final @NonNull AgentPoolManager pool;

  @GetMapping
  public ResponseEntity<PoolStatistics> statistics() {
    return ResponseEntity.ok(pool.statistics());
  }

  @GetMapping("/agents/{agentId}")
  public ResponseEntity<AgentSnapshot> agent(@PathVariable String agentId) {
    return ResponseEntity.of(pool.getAgent(agentId));
  }

  /**
   * Registers an agent. It stays offline until the next health check logs it in.
   */
  @PostMapping("/agents")
  public ResponseEntity<AgentSnapshot> register(@Valid @RequestBody RegisterAgentRequest request) {
    AgentSnapshot snapshot = pool.register(new AgentConfig(request.accountName(), request.credentialsRef(), request.steamId()));
    return ResponseEntity.status(HttpStatus.CREATED).body(snapshot);
  }

  @DeleteMapping("/agents/{agentId}")
  public ResponseEntity<Void> unregister(@PathVariable String agentId) {
    return pool.unregister(agentId) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
  }

  @PostMapping("/health-check")
  public ResponseEntity<PoolStatistics> healthCheck() {
    pool.runHealthCheck();
    return ResponseEntity.ok(pool.statistics());
  }

  public record RegisterAgentRequest(@NotBlank String accountName, String credentialsRef, String steamId) {
  }
}
