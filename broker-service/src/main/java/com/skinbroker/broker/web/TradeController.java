package com.skinbroker.broker.web;

import com.skinbroker.escrow.EscrowService;
import com.skinbroker.escrow.Trade;
import com.skinbroker.escrow.TradeStatus;
import com.skinbroker.escrow.TradeTransition;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/trades")
@Validated
@RequiredArgsConstructor
@Slf4j
public class TradeController {

  private final @NonNull EscrowService escrowService;

  @PostMapping
  public ResponseEntity<Trade> initiate(@Valid @RequestBody InitiateTradeRequest request) {
    Trade trade = escrowService.initiate(request.toNewTrade());
    return ResponseEntity.status(HttpStatus.CREATED).body(trade);
  }

  @GetMapping("/{tradeId}")
  public ResponseEntity<Trade> get(@PathVariable String tradeId) {
    return ResponseEntity.ok(escrowService.get(tradeId));
  }

  @GetMapping("/{tradeId}/history")
  public ResponseEntity<List<TradeTransition>> history(@PathVariable String tradeId) {
    return ResponseEntity.ok(escrowService.history(tradeId));
  }

  @PostMapping("/{tradeId}/payment")
  public ResponseEntity<Trade> confirmPayment(@PathVariable String tradeId) {
    return ResponseEntity.ok(escrowService.confirmPayment(tradeId));
  }

  @PostMapping("/{tradeId}/cancel")
  public ResponseEntity<Trade> cancel(@PathVariable String tradeId, @RequestBody(required = false) ReasonRequest request) {
    return ResponseEntity.ok(escrowService.cancel(tradeId, request == null ? null : request.reason()));
  }

  @PostMapping("/{tradeId}/override")
  public ResponseEntity<Trade> override(@PathVariable String tradeId, @Valid @RequestBody OverrideRequest request) {
    log.warn("manual trade override requested tradeId={} target={} reason={}", tradeId, request.status(), request.reason());
    return ResponseEntity.ok(escrowService.overrideStatus(tradeId, request.status(), request.reason()));
  }

  public record ReasonRequest(String reason) {
  }

  public record OverrideRequest(@NotNull TradeStatus status, String reason) {
  }
}
