package com.meshx.exchange.tx;

import com.meshx.exchange.crypto.EcSignature;
import com.meshx.exchange.error.ExchangeError;
import com.meshx.exchange.error.ExchangeException;
import com.meshx.exchange.order.Order;
import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Parses relayed call payloads laid out as described in {@link CalldataLayout}.
 */
public final class CalldataDecoder {

  private CalldataDecoder() {
  }

  public static byte[] selectorOf(byte[] payload) {
    if (payload == null || payload.length < CalldataLayout.SELECTOR_LENGTH) {
      throw malformed("payload shorter than a selector");
    }
    return Arrays.copyOf(payload, CalldataLayout.SELECTOR_LENGTH);
  }

  public static boolean isFillOrder(byte[] payload) {
    return Arrays.equals(selectorOf(payload), CalldataLayout.fillOrderSelector());
  }

  public static FillOrderArgs decodeFillOrderArgs(byte[] payload) {
    if (!isFillOrder(payload)) {
      throw malformed("selector is not fillOrder");
    }
    if (payload.length < CalldataLayout.HEAD_LENGTH) {
      throw malformed("payload length " + payload.length + " below minimum " + CalldataLayout.HEAD_LENGTH);
    }

    WordReader in = new WordReader(payload, CalldataLayout.SELECTOR_LENGTH);
    Order order = new Order(
        in.address("senderAddress"),
        in.address("makerAddress"),
        in.address("takerAddress"),
        in.address("makerAssetAddress"),
        in.address("takerAssetAddress"),
        in.address("feeRecipientAddress"),
        in.uint256(),
        in.uint256(),
        in.uint256(),
        in.uint256(),
        in.uint256(),
        in.uint256()
    );
    BigInteger takerAssetFillAmount = in.uint256();

    BigInteger signatureLength = in.uint256();
    if (signatureLength.compareTo(BigInteger.valueOf(EcSignature.LENGTH)) != 0) {
      throw malformed("signature length " + signatureLength + ", expected " + EcSignature.LENGTH);
    }
    if (in.remaining() != EcSignature.LENGTH) {
      throw malformed("expected " + EcSignature.LENGTH + " signature bytes, found " + in.remaining());
    }
    EcSignature signature = EcSignature.fromVrsBytes(in.bytes(EcSignature.LENGTH));
    return new FillOrderArgs(order, takerAssetFillAmount, signature);
  }

  private static ExchangeException malformed(String detail) {
    return new ExchangeException(ExchangeError.MALFORMED_CALLDATA, detail);
  }

  private static final class WordReader {

    private final ByteBuffer buffer;

    WordReader(byte[] payload, int offset) {
      this.buffer = ByteBuffer.wrap(payload);
      this.buffer.position(offset);
    }

    Address address(String field) {
      byte[] word = bytes(CalldataLayout.WORD_LENGTH);
      for (int i = 0; i < 12; i++) {
        if (word[i] != 0) {
          throw malformed(field + " has non-zero padding");
        }
      }
      return new Address(new BigInteger(1, Arrays.copyOfRange(word, 12, CalldataLayout.WORD_LENGTH)));
    }

    BigInteger uint256() {
      return new BigInteger(1, bytes(CalldataLayout.WORD_LENGTH));
    }

    byte[] bytes(int length) {
      byte[] out = new byte[length];
      buffer.get(out);
      return out;
    }

    int remaining() {
      return buffer.remaining();
    }
  }
}
