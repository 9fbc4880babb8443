package com.meshx.exchange.tx;

import com.meshx.exchange.crypto.EcSignature;
import com.meshx.exchange.order.Addresses;
import com.meshx.exchange.order.Order;
import lombok.NonNull;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;

/**
 * Builds fill-order payloads for relays. Inverse of {@link CalldataDecoder}.
 */
public final class CalldataEncoder {

  private CalldataEncoder() {
  }

  public static byte[] encodeFillOrder(
      @NonNull Order order,
      @NonNull BigInteger takerAssetFillAmount,
      @NonNull EcSignature signature
  ) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(CalldataLayout.FILL_ORDER_LENGTH);
    out.writeBytes(CalldataLayout.fillOrderSelector());

    out.writeBytes(Addresses.toWord(order.senderAddress()));
    out.writeBytes(Addresses.toWord(order.makerAddress()));
    out.writeBytes(Addresses.toWord(order.takerAddress()));
    out.writeBytes(Addresses.toWord(order.makerAssetAddress()));
    out.writeBytes(Addresses.toWord(order.takerAssetAddress()));
    out.writeBytes(Addresses.toWord(order.feeRecipientAddress()));
    out.writeBytes(uint256(order.makerAssetAmount()));
    out.writeBytes(uint256(order.takerAssetAmount()));
    out.writeBytes(uint256(order.makerFeeAmount()));
    out.writeBytes(uint256(order.takerFeeAmount()));
    out.writeBytes(uint256(order.expirationTimeSeconds()));
    out.writeBytes(uint256(order.salt()));

    out.writeBytes(uint256(takerAssetFillAmount));

    out.writeBytes(uint256(BigInteger.valueOf(EcSignature.LENGTH)));
    out.writeBytes(signature.toVrsBytes());
    return out.toByteArray();
  }

  private static byte[] uint256(BigInteger v) {
    return Numeric.toBytesPadded(v, CalldataLayout.WORD_LENGTH);
  }
}
