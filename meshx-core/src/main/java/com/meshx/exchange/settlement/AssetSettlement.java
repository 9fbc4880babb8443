package com.meshx.exchange.settlement;

import com.meshx.exchange.order.Order;
import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;

/**
 * Moves value for a fill that the settlement core has already validated and recorded:
 * the maker asset from maker to taker, {@code takerAssetFilledAmount} of the taker asset from taker
 * to maker, and both fees to the fee recipient. All transfers happen or none do.
 */
@FunctionalInterface
public interface AssetSettlement {

  SettlementResult settle(Order order, Address takerAddress, BigInteger takerAssetFilledAmount)
      throws SettlementException;
}
