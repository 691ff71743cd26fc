package com.skinbroker.broker.web;

import com.skinbroker.error.BrokerException;
import com.skinbroker.error.ErrorCode;
import com.skinbroker.error.InvalidStateTransitionException;
import com.skinbroker.error.TradeNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.HandlerMapping;

import java.util.Map;

/**
 * Maps failures to {@code {code, message, tradeId}}. Messages are fixed per code; causes stay in the log.
 * The trade reference comes from the exception or, failing that, from the {@code {tradeId}} path variable.
 */
@RestControllerAdvice
@Slf4j
public class BrokerExceptionHandler {

  @ExceptionHandler(BrokerException.class)
  public ResponseEntity<ErrorResponse> handle(BrokerException e, HttpServletRequest request) {
    HttpStatus status = statusOf(e.code());
    String tradeId = tradeIdOf(e, request);
    if (status.is5xxServerError()) {
      log.warn("request failed code={} tradeId={} error={}", e.code(), tradeId, e.getMessage(), e);
    } else {
      log.info("request rejected code={} tradeId={} error={}", e.code(), tradeId, e.getMessage());
    }
    return ResponseEntity.status(status).body(new ErrorResponse(e.code().name(), messageOf(e.code()), tradeId));
  }

  @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class, IllegalArgumentException.class})
  public ResponseEntity<ErrorResponse> handleInvalid(Exception e, HttpServletRequest request) {
    String tradeId = pathTradeId(request);
    log.info("invalid request tradeId={} error={}", tradeId, e.getMessage());
    return ResponseEntity.badRequest().body(new ErrorResponse(ErrorCode.INVALID_REQUEST.name(), messageOf(ErrorCode.INVALID_REQUEST), tradeId));
  }

  static HttpStatus statusOf(ErrorCode code) {
    return switch (code) {
      case INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
      case TRADE_NOT_FOUND -> HttpStatus.NOT_FOUND;
      case DUPLICATE_AGENT, INVALID_STATE_TRANSITION -> HttpStatus.CONFLICT;
      case TRADE_BLOCKED -> HttpStatus.UNPROCESSABLE_ENTITY;
      case NO_AGENT_AVAILABLE, RATE_LIMIT_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
      case TRANSPORT_ERROR, LOGIN_FAILED -> HttpStatus.BAD_GATEWAY;
      case INTERNAL_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
    };
  }

  private static String messageOf(ErrorCode code) {
    return switch (code) {
      case INVALID_REQUEST -> "Request is invalid";
      case TRADE_NOT_FOUND -> "Trade not found";
      case DUPLICATE_AGENT -> "Agent already registered";
      case INVALID_STATE_TRANSITION -> "Trade cannot move to the requested status";
      case TRADE_BLOCKED -> "Trade blocked by pre-trade check";
      case NO_AGENT_AVAILABLE -> "No trading agent available, try again later";
      case RATE_LIMIT_UNAVAILABLE -> "Trade service temporarily unavailable, try again later";
      case TRANSPORT_ERROR, LOGIN_FAILED -> "Trade platform unavailable, try again later";
      case INTERNAL_ERROR -> "Internal error";
    };
  }

  private static String tradeIdOf(BrokerException e, HttpServletRequest request) {
    if (e instanceof TradeNotFoundException nf) {
      return nf.tradeId();
    }
    if (e instanceof InvalidStateTransitionException ist) {
      return ist.tradeId();
    }
    return pathTradeId(request);
  }

  private static String pathTradeId(HttpServletRequest request) {
    Object vars = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
    if (vars instanceof Map<?, ?> map && map.get("tradeId") instanceof String tradeId) {
      return tradeId;
    }
    return null;
  }

  public record ErrorResponse(String code, String message, String tradeId) {
  }
}
