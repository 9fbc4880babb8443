package com.meshx.exchange.events;

import com.meshx.exchange.order.OrderHash;
import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;

public record CancelEvent(
    OrderHash orderHash,
    Address makerAddress,
    Address feeRecipientAddress,
    Address makerAssetAddress,
    Address takerAssetAddress,
    BigInteger makerAssetCancelledAmount,
    BigInteger takerAssetCancelledAmount
) implements ExchangeEvent {

  @Override
  public String type() {
    return "Cancel";
  }
}
