package com.meshx.exchange.order;

import java.math.BigInteger;
import java.security.SecureRandom;

public final class Orders {

  private static final SecureRandom RANDOM = new SecureRandom();

  private Orders() {
  }

  /**
   * Random 256-bit salt, so two otherwise identical orders still hash differently.
   */
  public static BigInteger generatePseudoRandomSalt() {
    return new BigInteger(256, RANDOM);
  }
}
