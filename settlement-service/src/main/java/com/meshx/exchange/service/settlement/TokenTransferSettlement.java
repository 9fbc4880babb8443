package com.meshx.exchange.service.settlement;

import com.meshx.exchange.order.Order;
import com.meshx.exchange.settlement.AssetSettlement;
import com.meshx.exchange.settlement.SettlementException;
import com.meshx.exchange.settlement.SettlementResult;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Settles a fill as one batch of vault transfers. Fees are paid in {@code feeAssetAddress}.
 */
@RequiredArgsConstructor
public class TokenTransferSettlement implements AssetSettlement {

  private final @NonNull InMemoryTokenVault vault;
  private final @NonNull Address feeAssetAddress;

  @Override
  public SettlementResult settle(Order order, Address takerAddress, BigInteger takerAssetFilledAmount)
      throws SettlementException {
    SettlementResult result;
    try {
      result = SettlementResult.forFill(order, takerAssetFilledAmount);
    } catch (RuntimeException e) {
      throw new SettlementException("cannot compute settlement amounts: " + e.getMessage(), e);
    }

    List<TokenTransfer> transfers = new ArrayList<>(4);
    transfers.add(new TokenTransfer(
        order.makerAssetAddress(), order.makerAddress(), takerAddress, result.makerAssetFilledAmount()));
    transfers.add(new TokenTransfer(
        order.takerAssetAddress(), takerAddress, order.makerAddress(), takerAssetFilledAmount));
    if (order.paysFees()) {
      transfers.add(new TokenTransfer(
          feeAssetAddress, order.makerAddress(), order.feeRecipientAddress(), result.makerFeePaid()));
      transfers.add(new TokenTransfer(
          feeAssetAddress, takerAddress, order.feeRecipientAddress(), result.takerFeePaid()));
    }
    vault.transferAll(transfers);
    return result;
  }
}
