package com.meshx.exchange.events;

import com.meshx.exchange.order.OrderHash;
import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;

public record FillEvent(
    OrderHash orderHash,
    Address makerAddress,
    Address takerAddress,
    Address feeRecipientAddress,
    Address makerAssetAddress,
    Address takerAssetAddress,
    BigInteger makerAssetFilledAmount,
    BigInteger takerAssetFilledAmount,
    BigInteger makerFeePaid,
    BigInteger takerFeePaid
) implements ExchangeEvent {

  @Override
  public String type() {
    return "Fill";
  }
}
