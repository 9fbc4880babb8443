package com.meshx.exchange.ledger;

import org.web3j.utils.Numeric;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Identity of a relayed meta-transaction, {@code keccak256(nonce || payload)}.
 */
public record TransactionHash(String value) {

  private static final Pattern HASH_HEX = Pattern.compile("^0x[0-9a-fA-F]{64}$");

  public TransactionHash {
    if (value == null || !HASH_HEX.matcher(value).matches()) {
      throw new IllegalArgumentException("Expected 0x-prefixed 32-byte hex, got: " + value);
    }
    value = value.toLowerCase(Locale.ROOT);
  }

  public static TransactionHash of(byte[] digest) {
    if (digest == null || digest.length != 32) {
      throw new IllegalArgumentException("Expected 32-byte digest");
    }
    return new TransactionHash(Numeric.toHexString(digest));
  }

  public byte[] toBytes() {
    return Numeric.hexStringToByteArray(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
