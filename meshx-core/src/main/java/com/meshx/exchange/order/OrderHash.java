package com.meshx.exchange.order;

import org.web3j.utils.Numeric;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Keccak-256 identity of an order, held as {@code 0x} followed by 64 lowercase hex digits.
 */
public record OrderHash(String value) {

  private static final Pattern HASH_HEX = Pattern.compile("^0x[0-9a-fA-F]{64}$");

  public OrderHash {
    if (!isValid(value)) {
      throw new IllegalArgumentException("Expected 0x-prefixed 32-byte hex, got: " + value);
    }
    value = value.toLowerCase(Locale.ROOT);
  }

  public static boolean isValid(String hex) {
    return hex != null && HASH_HEX.matcher(hex).matches();
  }

  public static OrderHash parse(String hex) {
    return new OrderHash(hex);
  }

  public static OrderHash of(byte[] digest) {
    if (digest == null || digest.length != 32) {
      throw new IllegalArgumentException("Expected 32-byte digest");
    }
    return new OrderHash(Numeric.toHexString(digest));
  }

  public byte[] toBytes() {
    return Numeric.hexStringToByteArray(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
