package com.meshx.exchange.settlement;

import com.meshx.exchange.math.RoundingGuard;
import com.meshx.exchange.order.Order;
import lombok.NonNull;

import java.math.BigInteger;

public record SettlementResult(
    BigInteger makerAssetFilledAmount,
    BigInteger makerFeePaid,
    BigInteger takerFeePaid
) {

  /**
   * Amounts owed for a taker-side fill, each scaled by {@code takerAssetFilledAmount / takerAssetAmount}
   * with the same truncating division the rounding guard checks. No fees are owed without a fee recipient.
   */
  public static SettlementResult forFill(@NonNull Order order, @NonNull BigInteger takerAssetFilledAmount) {
    BigInteger makerAsset = RoundingGuard.partialAmount(
        takerAssetFilledAmount, order.takerAssetAmount(), order.makerAssetAmount());
    if (!order.paysFees()) {
      return new SettlementResult(makerAsset, BigInteger.ZERO, BigInteger.ZERO);
    }
    BigInteger makerFee = RoundingGuard.partialAmount(
        takerAssetFilledAmount, order.takerAssetAmount(), order.makerFeeAmount());
    BigInteger takerFee = RoundingGuard.partialAmount(
        takerAssetFilledAmount, order.takerAssetAmount(), order.takerFeeAmount());
    return new SettlementResult(makerAsset, makerFee, takerFee);
  }
}
