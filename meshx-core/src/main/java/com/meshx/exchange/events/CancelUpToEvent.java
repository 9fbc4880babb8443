package com.meshx.exchange.events;

import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;

/**
 * Every order from {@code makerAddress} with a salt below {@code makerEpoch} is now unfillable.
 */
public record CancelUpToEvent(Address makerAddress, BigInteger makerEpoch) implements ExchangeEvent {

  @Override
  public String type() {
    return "CancelUpTo";
  }
}
