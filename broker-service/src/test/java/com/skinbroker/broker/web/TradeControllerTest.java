package com.skinbroker.broker.web;

import com.skinbroker.error.BrokerException;
import com.skinbroker.error.ErrorCode;
import com.skinbroker.error.InvalidStateTransitionException;
import com.skinbroker.error.InvalidTradeRequestException;
import com.skinbroker.error.TradeBlockedException;
import com.skinbroker.error.TradeNotFoundException;
import com.skinbroker.escrow.EscrowService;
import com.skinbroker.escrow.NewTrade;
import com.skinbroker.escrow.Trade;
import com.skinbroker.escrow.TradeKind;
import com.skinbroker.escrow.TradeStatus;
import com.skinbroker.trade.TradeItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class TradeControllerTest {

  private static final String P2P_BODY = """
      {
        "kind": "P2P",
        "buyerSteamId": "76561198000000001",
        "buyerTradeUrl": "https://steamcommunity.com/tradeoffer/new/?partner=1&token=a",
        "sellerSteamId": "76561198000000002",
        "sellerTradeUrl": "https://steamcommunity.com/tradeoffer/new/?partner=2&token=b",
        "items": [{"assetId": "1001"}],
        "price": 25.00
      }
      """;

  private EscrowService escrowService;
  private MockMvc mvc;

  @BeforeEach
  void setUp() {
    escrowService = mock(EscrowService.class);
    mvc = MockMvcBuilders.standaloneSetup(new TradeController(escrowService))
        .setControllerAdvice(new BrokerExceptionHandler())
        .build();
  }

  @Test
  void initiateReturnsCreatedTrade() throws Exception {
    when(escrowService.initiate(any())).thenReturn(trade("t-1", TradeStatus.PENDING_PAYMENT));

    mvc.perform(post("/api/trades").contentType(MediaType.APPLICATION_JSON).content(P2P_BODY))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.tradeId").value("t-1"))
        .andExpect(jsonPath("$.status").value("PENDING_PAYMENT"));

    ArgumentCaptor<NewTrade> captor = ArgumentCaptor.forClass(NewTrade.class);
    verify(escrowService).initiate(captor.capture());
    assertThat(captor.getValue().kind()).isEqualTo(TradeKind.P2P);
    assertThat(captor.getValue().items()).containsExactly(new TradeItem("1001", 730, "2"));
    assertThat(captor.getValue().currency()).isEqualTo("USD");
  }

  @Test
  void initiateWithoutItemsIsRejectedBeforeReachingEscrow() throws Exception {
    String body = P2P_BODY.replace("[{\"assetId\": \"1001\"}]", "[]");

    mvc.perform(post("/api/trades").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));

    verifyNoInteractions(escrowService);
  }

  @Test
  void domainValidationFailureMapsToBadRequest() throws Exception {
    when(escrowService.initiate(any())).thenThrow(new InvalidTradeRequestException("seller trade url is required for P2P"));

    mvc.perform(post("/api/trades").contentType(MediaType.APPLICATION_JSON).content(P2P_BODY))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("INVALID_REQUEST"))
        .andExpect(jsonPath("$.message").value("Request is invalid"));
  }

  @Test
  void unknownTradeIsNotFoundWithReference() throws Exception {
    when(escrowService.get("missing")).thenThrow(new TradeNotFoundException("missing"));

    mvc.perform(get("/api/trades/missing"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("TRADE_NOT_FOUND"))
        .andExpect(jsonPath("$.tradeId").value("missing"));
  }

  @Test
  void cancelAfterPaymentIsConflict() throws Exception {
    when(escrowService.cancel(eq("t-2"), isNull()))
        .thenThrow(new InvalidStateTransitionException("t-2", TradeStatus.PAYMENT_RECEIVED, TradeStatus.CANCELLED));

    mvc.perform(post("/api/trades/t-2/cancel"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("INVALID_STATE_TRANSITION"))
        .andExpect(jsonPath("$.message").value("Trade cannot move to the requested status"))
        .andExpect(jsonPath("$.tradeId").value("t-2"));
  }

  @Test
  void overrideWithUnknownStatusIsBadRequest() throws Exception {
    mvc.perform(post("/api/trades/t-3/override").contentType(MediaType.APPLICATION_JSON)
            .content("{\"status\": \"REFUNDED\", \"reason\": \"ops\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("INVALID_REQUEST"))
        .andExpect(jsonPath("$.tradeId").value("t-3"));

    verifyNoInteractions(escrowService);
  }

  @Test
  void failuresWithoutOwnReferenceCarryTheTradeFromThePath() throws Exception {
    when(escrowService.confirmPayment("t-8")).thenThrow(new TradeBlockedException("flagged account"));
    when(escrowService.confirmPayment("t-9")).thenThrow(new BrokerException(ErrorCode.INTERNAL_ERROR, "Concurrent updates on trade t-9", true));

    mvc.perform(post("/api/trades/t-8/payment"))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("TRADE_BLOCKED"))
        .andExpect(jsonPath("$.message").value("Trade blocked by pre-trade check"))
        .andExpect(jsonPath("$.tradeId").value("t-8"));
    mvc.perform(post("/api/trades/t-9/payment"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"))
        .andExpect(jsonPath("$.message").value("Internal error"))
        .andExpect(jsonPath("$.tradeId").value("t-9"));
  }

  @Test
  void failuresOutsideATradeHaveNoReference() throws Exception {
    when(escrowService.initiate(any())).thenThrow(new InvalidTradeRequestException("price must be >= 0"));

    mvc.perform(post("/api/trades").contentType(MediaType.APPLICATION_JSON).content(P2P_BODY))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.tradeId").doesNotExist());
  }

  @Test
  void overrideDelegatesTargetAndReason() throws Exception {
    when(escrowService.overrideStatus("t-4", TradeStatus.FAILED, "item lost")).thenReturn(trade("t-4", TradeStatus.FAILED));

    mvc.perform(post("/api/trades/t-4/override").contentType(MediaType.APPLICATION_JSON)
            .content("{\"status\": \"FAILED\", \"reason\": \"item lost\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("FAILED"));
  }

  @ParameterizedTest
  @EnumSource(ErrorCode.class)
  void everyErrorCodeHasAnHttpStatus(ErrorCode code) {
    HttpStatus status = BrokerExceptionHandler.statusOf(code);

    assertThat(status.isError()).isTrue();
    assertThat(status.is5xxServerError()).isEqualTo(code == ErrorCode.NO_AGENT_AVAILABLE
        || code == ErrorCode.RATE_LIMIT_UNAVAILABLE
        || code == ErrorCode.TRANSPORT_ERROR
        || code == ErrorCode.LOGIN_FAILED
        || code == ErrorCode.INTERNAL_ERROR);
  }

  private static Trade trade(String tradeId, TradeStatus status) {
    Instant now = Instant.parse("2024-05-01T12:00:00Z");
    return new Trade(tradeId, TradeKind.P2P, "76561198000000001", "https://buyer", "76561198000000002", "https://seller",
        List.of(TradeItem.of("1001")), new BigDecimal("25.00"), "USD", status, 0, null, null, null, now, now, 0L);
  }
}
