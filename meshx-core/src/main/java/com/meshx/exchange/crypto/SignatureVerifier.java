package com.meshx.exchange.crypto;

import org.web3j.abi.datatypes.Address;

public interface SignatureVerifier {

  /**
   * True when {@code signature} was produced by {@code expectedSigner}'s key over {@code messageHash}.
   * Implementations return false rather than throw on malformed input.
   */
  boolean isValidSignature(byte[] messageHash, EcSignature signature, Address expectedSigner);
}
