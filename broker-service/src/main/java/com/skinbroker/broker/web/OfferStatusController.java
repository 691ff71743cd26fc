package com.skinbroker.broker.web;

import com.skinbroker.escrow.OfferState;
import com.skinbroker.escrow.OfferStateChange;
import com.skinbroker.escrow.OfferStatusListener;
import com.skinbroker.trade.TradeItem;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;

/**
 * Entry point for offer state changes observed by an out-of-process offer poller.
 */
@RestController
@RequestMapping("/api/offers")
@Validated
@RequiredArgsConstructor
public class OfferStatusController {

  private final @NonNull OfferStatusListener offerStatusListener;
  private final @NonNull Clock clock;

  @PostMapping("/state")
  public ResponseEntity<Void> stateChanged(@Valid @RequestBody OfferStateRequest request) {
    List<TradeItem> received = request.receivedAssetIds() == null
        ? List.of()
        : request.receivedAssetIds().stream().map(TradeItem::of).toList();
    offerStatusListener.onOfferStateChanged(new OfferStateChange(
        request.offerId(),
        OfferState.fromCode(request.state()),
        received,
        clock.instant()
    ));
    return ResponseEntity.accepted().build();
  }

  /**
   * @param state numeric Steam offer state, e.g. 3 for accepted
   */
  public record OfferStateRequest(
      @NotBlank String offerId,
      @NotNull Integer state,
      List<String> receivedAssetIds
  ) {
  }
}
