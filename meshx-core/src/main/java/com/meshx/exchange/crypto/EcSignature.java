package com.meshx.exchange.crypto;

import lombok.NonNull;
import org.web3j.crypto.Sign.SignatureData;
import org.web3j.utils.Numeric;

/**
 * secp256k1 signature triple. {@code r} and {@code s} are 0x-prefixed 32-byte hex strings.
 * Nothing is validated on construction; a malformed signature simply fails verification.
 */
public record EcSignature(int v, String r, String s) {

  public static final int LENGTH = 65;

  /**
   * Some signers report the recovery id as 0/1 instead of 27/28.
   */
  public int normalizedV() {
    return v < 27 ? v + 27 : v;
  }

  /**
   * Parses the {@code v || r || s} byte layout used in calldata.
   */
  public static EcSignature fromVrsBytes(@NonNull byte[] bytes) {
    requireLength(bytes);
    return new EcSignature(
        bytes[0] & 0xFF,
        Numeric.toHexString(bytes, 1, 32, true),
        Numeric.toHexString(bytes, 33, 32, true)
    );
  }

  /**
   * Parses the {@code r || s || v} hex string returned by JSON-RPC signing endpoints.
   */
  public static EcSignature fromRpcSignature(@NonNull String hex) {
    byte[] bytes = Numeric.hexStringToByteArray(hex);
    requireLength(bytes);
    return new EcSignature(
        bytes[64] & 0xFF,
        Numeric.toHexString(bytes, 0, 32, true),
        Numeric.toHexString(bytes, 32, 32, true)
    );
  }

  public static EcSignature fromSignatureData(@NonNull SignatureData data) {
    return new EcSignature(
        data.getV()[0] & 0xFF,
        Numeric.toHexString(data.getR()),
        Numeric.toHexString(data.getS())
    );
  }

  public byte[] toVrsBytes() {
    byte[] rBytes = word(r, "r");
    byte[] sBytes = word(s, "s");
    byte[] out = new byte[LENGTH];
    out[0] = (byte) normalizedV();
    System.arraycopy(rBytes, 0, out, 1, 32);
    System.arraycopy(sBytes, 0, out, 33, 32);
    return out;
  }

  private static byte[] word(String hex, String name) {
    byte[] bytes = hex == null ? new byte[0] : Numeric.hexStringToByteArray(hex);
    if (bytes.length != 32) {
      throw new IllegalArgumentException("Expected 32-byte " + name + ", got len=" + bytes.length);
    }
    return bytes;
  }

  private static void requireLength(byte[] bytes) {
    if (bytes.length != LENGTH) {
      throw new IllegalArgumentException("Expected " + LENGTH + "-byte signature, got len=" + bytes.length);
    }
  }
}
