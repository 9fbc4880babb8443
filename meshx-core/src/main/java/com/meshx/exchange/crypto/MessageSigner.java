package com.meshx.exchange.crypto;

import com.meshx.exchange.error.ExchangeError;
import com.meshx.exchange.error.ExchangeException;
import com.meshx.exchange.order.OrderHash;
import lombok.NonNull;
import org.web3j.abi.datatypes.Address;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;

/**
 * Local-key counterpart of {@link PersonalMessageSignatureVerifier}, used by makers and relayers.
 */
public final class MessageSigner {

  private static final PersonalMessageSignatureVerifier VERIFIER = new PersonalMessageSignatureVerifier();

  private MessageSigner() {
  }

  /**
   * Applies the personal-message prefix to {@code messageHash}, then signs.
   */
  public static EcSignature sign(@NonNull byte[] messageHash, @NonNull ECKeyPair keyPair) {
    return EcSignature.fromSignatureData(Sign.signPrefixedMessage(messageHash, keyPair));
  }

  /**
   * Signs a digest the caller already prefixed, as a signer host that prefixes internally would.
   */
  public static EcSignature signDigest(@NonNull byte[] prefixedDigest, @NonNull ECKeyPair keyPair) {
    return EcSignature.fromSignatureData(Sign.signMessage(prefixedDigest, keyPair, false));
  }

  /**
   * Signs an order hash and checks the result recovers to the key's own address.
   */
  public static EcSignature signOrderHash(@NonNull OrderHash orderHash, @NonNull ECKeyPair keyPair) {
    byte[] hash = orderHash.toBytes();
    EcSignature signature = sign(hash, keyPair);
    if (!VERIFIER.isValidSignature(hash, signature, addressOf(keyPair))) {
      throw new ExchangeException(ExchangeError.INVALID_SIGNATURE, "self-check failed for order " + orderHash);
    }
    return signature;
  }

  public static Address addressOf(@NonNull ECKeyPair keyPair) {
    return new Address(Keys.getAddress(keyPair));
  }
}
