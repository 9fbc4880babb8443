package com.meshx.exchange.crypto;

import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.datatypes.Address;
import org.web3j.crypto.ECDSASignature;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Verifies signatures made over the personal-message digest
 * {@code keccak256("\x19Ethereum Signed Message:\n32" || messageHash)}.
 * <p>
 * {@link #recoversTo} skips the prefixing step for callers that already hold the prefixed digest.
 */
@Slf4j
public class PersonalMessageSignatureVerifier implements SignatureVerifier {

  @Override
  public boolean isValidSignature(byte[] messageHash, EcSignature signature, Address expectedSigner) {
    if (messageHash == null || messageHash.length != 32) {
      return false;
    }
    return recoversTo(prefixedDigest(messageHash), signature, expectedSigner);
  }

  public boolean recoversTo(byte[] digest, EcSignature signature, Address expectedSigner) {
    if (expectedSigner == null) {
      return false;
    }
    return recoverSigner(digest, signature)
        .map(expectedSigner::equals)
        .orElse(false);
  }

  public Optional<Address> recoverSigner(byte[] digest, EcSignature signature) {
    if (digest == null || digest.length != 32 || signature == null) {
      return Optional.empty();
    }
    int v = signature.normalizedV();
    if (v != 27 && v != 28) {
      return Optional.empty();
    }
    try {
      byte[] r = Numeric.hexStringToByteArray(signature.r());
      byte[] s = Numeric.hexStringToByteArray(signature.s());
      if (r.length != 32 || s.length != 32) {
        return Optional.empty();
      }
      ECDSASignature ecdsa = new ECDSASignature(new BigInteger(1, r), new BigInteger(1, s));
      BigInteger publicKey = Sign.recoverFromSignature(v - 27, ecdsa, digest);
      if (publicKey == null) {
        return Optional.empty();
      }
      return Optional.of(new Address(Keys.getAddress(publicKey)));
    } catch (RuntimeException e) {
      log.debug("signature recovery failed: {}", e.toString());
      return Optional.empty();
    }
  }

  public static byte[] prefixedDigest(byte[] messageHash) {
    return Sign.getEthereumMessageHash(messageHash);
  }
}
