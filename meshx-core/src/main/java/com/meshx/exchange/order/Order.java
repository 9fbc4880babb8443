package com.meshx.exchange.order;

import com.meshx.exchange.error.ExchangeError;
import com.meshx.exchange.error.ExchangeException;
import com.meshx.exchange.math.Uint256Math;
import lombok.Builder;
import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;

/**
 * A maker's signed intent to trade {@code makerAssetAmount} of one asset for
 * {@code takerAssetAmount} of another. A zero {@code senderAddress} or {@code takerAddress}
 * means anyone may submit or take the order.
 */
@Builder(toBuilder = true)
public record Order(
    Address senderAddress,
    Address makerAddress,
    Address takerAddress,
    Address makerAssetAddress,
    Address takerAssetAddress,
    Address feeRecipientAddress,
    BigInteger makerAssetAmount,
    BigInteger takerAssetAmount,
    BigInteger makerFeeAmount,
    BigInteger takerFeeAmount,
    BigInteger expirationTimeSeconds,
    BigInteger salt
) {

  public Order {
    senderAddress = Addresses.orZero(senderAddress);
    takerAddress = Addresses.orZero(takerAddress);
    feeRecipientAddress = Addresses.orZero(feeRecipientAddress);
    requireAddress(makerAddress, "makerAddress");
    requireAddress(makerAssetAddress, "makerAssetAddress");
    requireAddress(takerAssetAddress, "takerAssetAddress");
    makerFeeAmount = makerFeeAmount == null ? BigInteger.ZERO : makerFeeAmount;
    takerFeeAmount = takerFeeAmount == null ? BigInteger.ZERO : takerFeeAmount;
    requireUint256(makerAssetAmount, "makerAssetAmount");
    requireUint256(takerAssetAmount, "takerAssetAmount");
    requireUint256(makerFeeAmount, "makerFeeAmount");
    requireUint256(takerFeeAmount, "takerFeeAmount");
    requireUint256(expirationTimeSeconds, "expirationTimeSeconds");
    requireUint256(salt, "salt");
  }

  public boolean hasSenderRestriction() {
    return !Addresses.isZero(senderAddress);
  }

  public boolean hasTakerRestriction() {
    return !Addresses.isZero(takerAddress);
  }

  public boolean paysFees() {
    return !Addresses.isZero(feeRecipientAddress);
  }

  private static void requireAddress(Address value, String field) {
    if (value == null) {
      throw new ExchangeException(ExchangeError.INVALID_ORDER, field + " must not be null");
    }
  }

  private static void requireUint256(BigInteger value, String field) {
    if (!Uint256Math.isUint256(value)) {
      throw new ExchangeException(ExchangeError.INVALID_ORDER, field + " must be a uint256, got " + value);
    }
  }
}
