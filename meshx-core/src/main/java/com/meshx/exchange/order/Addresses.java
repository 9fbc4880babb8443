package com.meshx.exchange.order;

import org.web3j.abi.datatypes.Address;
import org.web3j.utils.Numeric;

import java.math.BigInteger;

public final class Addresses {

  public static final Address ZERO = new Address(BigInteger.ZERO);

  private Addresses() {
  }

  public static boolean isZero(Address address) {
    return address == null || address.toUint().getValue().signum() == 0;
  }

  public static Address orZero(Address address) {
    return address == null ? ZERO : address;
  }

  /**
   * Natural 20-byte form of an address.
   */
  public static byte[] toBytes(Address address) {
    return Numeric.toBytesPadded(orZero(address).toUint().getValue(), 20);
  }

  /**
   * 32-byte word form of an address: 12 zero bytes followed by the 20 address bytes.
   */
  public static byte[] toWord(Address address) {
    return Numeric.toBytesPadded(orZero(address).toUint().getValue(), 32);
  }
}
