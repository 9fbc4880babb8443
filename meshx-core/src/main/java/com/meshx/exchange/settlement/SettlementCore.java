package com.meshx.exchange.settlement;

import com.meshx.exchange.crypto.EcSignature;
import com.meshx.exchange.crypto.SignatureVerifier;
import com.meshx.exchange.error.ExchangeError;
import com.meshx.exchange.error.ExchangeException;
import com.meshx.exchange.events.CancelEvent;
import com.meshx.exchange.events.CancelUpToEvent;
import com.meshx.exchange.events.ExchangeEvent;
import com.meshx.exchange.events.ExchangeEventSink;
import com.meshx.exchange.events.FillEvent;
import com.meshx.exchange.events.OrderRejectedEvent;
import com.meshx.exchange.events.RejectReason;
import com.meshx.exchange.ledger.FillLedger;
import com.meshx.exchange.ledger.FillLedgerEntry;
import com.meshx.exchange.math.RoundingGuard;
import com.meshx.exchange.math.Uint256Math;
import com.meshx.exchange.order.Order;
import com.meshx.exchange.order.OrderHash;
import com.meshx.exchange.order.OrderHasher;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;
import java.time.Clock;

/**
 * Fill and cancel state machine for signed orders.
 * <p>
 * Each public operation runs as one ledger unit: validation, ledger writes and the settlement
 * callback either all take effect or none do. Hard failures throw {@link ExchangeException}.
 * Soft outcomes (expired, exhausted, too much rounding, bulk-cancelled) return zero and publish an
 * {@link OrderRejectedEvent} instead.
 * <p>
 * The maker's signature is only checked while the order's ledger entry is still empty; a recorded
 * fill or cancel proves it was checked before.
 */
@RequiredArgsConstructor
@Slf4j
public class SettlementCore {

  private final @NonNull Address venueAddress;
  private final @NonNull FillLedger ledger;
  private final @NonNull SignatureVerifier signatureVerifier;
  private final @NonNull AssetSettlement settlement;
  private final @NonNull ExchangeEventSink events;
  private final @NonNull Clock clock;

  public Address venueAddress() {
    return venueAddress;
  }

  public OrderHash hash(@NonNull Order order) {
    return OrderHasher.hash(order, venueAddress);
  }

  /**
   * Fills up to {@code takerAssetFillAmount} of the order's taker asset on behalf of
   * {@code takerAddress}, who is also the invoking party for the sender check.
   *
   * @return taker-asset amount actually filled; zero for a soft outcome
   */
  public BigInteger fillOrder(
      @NonNull Order order,
      @NonNull BigInteger takerAssetFillAmount,
      EcSignature signature,
      @NonNull Address takerAddress
  ) {
    return ledger.atomically(() -> doFillOrder(order, takerAssetFillAmount, signature, takerAddress));
  }

  /**
   * Cancels up to {@code takerAssetCancelAmount} of the order. Only the maker may cancel.
   *
   * @return taker-asset amount actually cancelled; zero for a soft outcome
   */
  public BigInteger cancelOrder(
      @NonNull Order order,
      @NonNull BigInteger takerAssetCancelAmount,
      @NonNull Address callerAddress
  ) {
    return ledger.atomically(() -> doCancelOrder(order, takerAssetCancelAmount, callerAddress));
  }

  /**
   * Cancels every order of {@code callerAddress} with a salt up to and including {@code salt}.
   *
   * @return the caller's new epoch, {@code salt + 1}
   */
  public BigInteger cancelOrdersUpTo(@NonNull BigInteger salt, @NonNull Address callerAddress) {
    return ledger.atomically(() -> {
      BigInteger newEpoch = Uint256Math.add(salt, BigInteger.ONE);
      ledger.bumpMakerEpoch(callerAddress, newEpoch);
      publish(new CancelUpToEvent(callerAddress, newEpoch));
      log.info("orders cancelled up to epoch (maker={}, epoch={})", callerAddress, newEpoch);
      return newEpoch;
    });
  }

  public OrderInfo getOrderInfo(@NonNull Order order) {
    OrderHash orderHash = hash(order);
    FillLedgerEntry entry = ledger.getEntry(orderHash);
    BigInteger remaining = Uint256Math.sub(order.takerAssetAmount(), entry.unavailableAmount());
    return new OrderInfo(
        orderHash,
        statusOf(order, entry, remaining, now()),
        entry.filledAmount(),
        entry.cancelledAmount(),
        remaining
    );
  }

  private BigInteger doFillOrder(Order order, BigInteger takerAssetFillAmount, EcSignature signature, Address takerAddress) {
    BigInteger now = now();
    OrderHash orderHash = hash(order);
    FillLedgerEntry entry = ledger.getEntry(orderHash);

    if (entry.isUnreferenced()) {
      requirePositive(order.makerAssetAmount(), "makerAssetAmount");
      requirePositive(order.takerAssetAmount(), "takerAssetAmount");
      if (!signatureVerifier.isValidSignature(orderHash.toBytes(), signature, order.makerAddress())) {
        throw new ExchangeException(ExchangeError.INVALID_SIGNATURE,
            "order " + orderHash + " is not signed by maker " + order.makerAddress());
      }
    }
    requireAuthorizedSender(order, takerAddress);
    if (order.hasTakerRestriction() && !order.takerAddress().equals(takerAddress)) {
      throw new ExchangeException(ExchangeError.UNAUTHORIZED_TAKER,
          "order " + orderHash + " is reserved for taker " + order.takerAddress());
    }
    requirePositive(takerAssetFillAmount, "takerAssetFillAmount");

    BigInteger remaining = Uint256Math.sub(order.takerAssetAmount(), entry.unavailableAmount());
    if (isExpired(order, now)) {
      return reject(RejectReason.ORDER_EXPIRED, orderHash, takerAssetFillAmount, remaining);
    }
    BigInteger filledAmount = takerAssetFillAmount.min(remaining);
    if (filledAmount.signum() == 0) {
      return reject(RejectReason.ORDER_UNFILLABLE, orderHash, takerAssetFillAmount, remaining);
    }
    if (RoundingGuard.hasRoundingError(filledAmount, order.takerAssetAmount(), order.makerAssetAmount())) {
      return reject(RejectReason.ROUNDING_ERROR_TOO_LARGE, orderHash, takerAssetFillAmount, remaining);
    }
    if (isBulkCancelled(order)) {
      return reject(RejectReason.ORDER_UNFILLABLE, orderHash, takerAssetFillAmount, remaining);
    }

    ledger.recordFill(orderHash, filledAmount);
    SettlementResult result;
    try {
      result = settlement.settle(order, takerAddress, filledAmount);
    } catch (SettlementException e) {
      throw new ExchangeException(ExchangeError.SETTLEMENT_FAILED,
          "settlement of order " + orderHash + " failed: " + e.getMessage(), e);
    }

    publish(new FillEvent(
        orderHash,
        order.makerAddress(),
        takerAddress,
        order.feeRecipientAddress(),
        order.makerAssetAddress(),
        order.takerAssetAddress(),
        result.makerAssetFilledAmount(),
        filledAmount,
        result.makerFeePaid(),
        result.takerFeePaid()
    ));
    log.debug("order filled (orderHash={}, taker={}, takerAssetFilled={}, makerAssetFilled={})",
        orderHash, takerAddress, filledAmount, result.makerAssetFilledAmount());
    return filledAmount;
  }

  private BigInteger doCancelOrder(Order order, BigInteger takerAssetCancelAmount, Address callerAddress) {
    BigInteger now = now();
    OrderHash orderHash = hash(order);
    FillLedgerEntry entry = ledger.getEntry(orderHash);

    requirePositive(order.makerAssetAmount(), "makerAssetAmount");
    requirePositive(order.takerAssetAmount(), "takerAssetAmount");
    requireAuthorizedSender(order, callerAddress);
    if (!order.makerAddress().equals(callerAddress)) {
      throw new ExchangeException(ExchangeError.UNAUTHORIZED_MAKER,
          "only maker " + order.makerAddress() + " may cancel order " + orderHash);
    }
    requirePositive(takerAssetCancelAmount, "takerAssetCancelAmount");

    BigInteger remaining = Uint256Math.sub(order.takerAssetAmount(), entry.unavailableAmount());
    if (isExpired(order, now)) {
      return reject(RejectReason.ORDER_EXPIRED, orderHash, takerAssetCancelAmount, remaining);
    }
    BigInteger cancelledAmount = takerAssetCancelAmount.min(remaining);
    if (cancelledAmount.signum() == 0) {
      return reject(RejectReason.ORDER_UNFILLABLE, orderHash, takerAssetCancelAmount, remaining);
    }

    ledger.recordCancel(orderHash, cancelledAmount);
    publish(new CancelEvent(
        orderHash,
        order.makerAddress(),
        order.feeRecipientAddress(),
        order.makerAssetAddress(),
        order.takerAssetAddress(),
        RoundingGuard.partialAmount(cancelledAmount, order.takerAssetAmount(), order.makerAssetAmount()),
        cancelledAmount
    ));
    log.debug("order cancelled (orderHash={}, takerAssetCancelled={})", orderHash, cancelledAmount);
    return cancelledAmount;
  }

  private OrderStatus statusOf(Order order, FillLedgerEntry entry, BigInteger remaining, BigInteger now) {
    if (order.makerAssetAmount().signum() == 0 || order.takerAssetAmount().signum() == 0) {
      return OrderStatus.INVALID;
    }
    if (remaining.signum() == 0) {
      return entry.cancelledAmount().signum() > 0 ? OrderStatus.CANCELLED : OrderStatus.FULLY_FILLED;
    }
    if (isExpired(order, now)) {
      return OrderStatus.EXPIRED;
    }
    if (isBulkCancelled(order)) {
      return OrderStatus.BULK_CANCELLED;
    }
    return entry.isUnreferenced() ? OrderStatus.FRESH : OrderStatus.PARTIALLY_FILLED;
  }

  private void requireAuthorizedSender(Order order, Address callerAddress) {
    if (order.hasSenderRestriction() && !order.senderAddress().equals(callerAddress)) {
      throw new ExchangeException(ExchangeError.UNAUTHORIZED_SENDER,
          "order may only be submitted by " + order.senderAddress() + ", not " + callerAddress);
    }
  }

  private boolean isBulkCancelled(Order order) {
    return order.salt().compareTo(ledger.getMakerEpoch(order.makerAddress())) < 0;
  }

  private static boolean isExpired(Order order, BigInteger now) {
    return now.compareTo(order.expirationTimeSeconds()) >= 0;
  }

  private BigInteger reject(RejectReason reason, OrderHash orderHash, BigInteger requested, BigInteger remaining) {
    publish(new OrderRejectedEvent(reason, orderHash, requested, remaining));
    log.debug("order not filled (orderHash={}, reason={}, requested={}, remaining={})",
        orderHash, reason, requested, remaining);
    return BigInteger.ZERO;
  }

  private void publish(ExchangeEvent event) {
    ledger.afterCommit(() -> events.publish(event));
  }

  private BigInteger now() {
    return BigInteger.valueOf(clock.instant().getEpochSecond());
  }

  private static void requirePositive(BigInteger amount, String field) {
    if (amount.signum() <= 0) {
      throw new ExchangeException(ExchangeError.INVALID_AMOUNT, field + " must be > 0");
    }
  }
}
