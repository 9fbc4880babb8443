package com.meshx.exchange.order;

import lombok.NonNull;
import org.web3j.abi.datatypes.Address;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;

/**
 * Computes an order's identity as keccak-256 over its tightly packed fields.
 * <pre>
 * venue(20) sender(20) maker(20) taker(20) makerAsset(20) takerAsset(20) feeRecipient(20)
 * makerAssetAmount(32) takerAssetAmount(32) makerFee(32) takerFee(32) expiration(32) salt(32)
 * </pre>
 * The venue address comes first so a signed order cannot be replayed on another exchange instance.
 */
public final class OrderHasher {

  private static final int PACKED_LENGTH = 7 * 20 + 6 * 32;

  private OrderHasher() {
  }

  public static OrderHash hash(@NonNull Order order, @NonNull Address venueAddress) {
    return OrderHash.of(Hash.sha3(pack(order, venueAddress)));
  }

  static byte[] pack(Order order, Address venueAddress) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(PACKED_LENGTH);
    out.writeBytes(Addresses.toBytes(venueAddress));
    out.writeBytes(Addresses.toBytes(order.senderAddress()));
    out.writeBytes(Addresses.toBytes(order.makerAddress()));
    out.writeBytes(Addresses.toBytes(order.takerAddress()));
    out.writeBytes(Addresses.toBytes(order.makerAssetAddress()));
    out.writeBytes(Addresses.toBytes(order.takerAssetAddress()));
    out.writeBytes(Addresses.toBytes(order.feeRecipientAddress()));
    out.writeBytes(uint256(order.makerAssetAmount()));
    out.writeBytes(uint256(order.takerAssetAmount()));
    out.writeBytes(uint256(order.makerFeeAmount()));
    out.writeBytes(uint256(order.takerFeeAmount()));
    out.writeBytes(uint256(order.expirationTimeSeconds()));
    out.writeBytes(uint256(order.salt()));
    return out.toByteArray();
  }

  private static byte[] uint256(BigInteger value) {
    return Numeric.toBytesPadded(value, 32);
  }
}
