package com.meshx.exchange.service.settlement;

import com.meshx.exchange.math.Uint256Math;
import com.meshx.exchange.settlement.SettlementException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Paper token balances used in place of on-chain token contracts. A batch of transfers is applied
 * all-or-nothing.
 */
@Slf4j
public class InMemoryTokenVault {

  private final Map<Holding, BigInteger> balances = new HashMap<>();

  public synchronized BigInteger balanceOf(@NonNull Address owner, @NonNull Address asset) {
    return balances.getOrDefault(new Holding(owner, asset), BigInteger.ZERO);
  }

  public synchronized void deposit(@NonNull Address owner, @NonNull Address asset, @NonNull BigInteger amount) {
    Holding holding = new Holding(owner, asset);
    balances.put(holding, Uint256Math.add(balances.getOrDefault(holding, BigInteger.ZERO), amount));
  }

  public synchronized void transferAll(@NonNull List<TokenTransfer> transfers) throws SettlementException {
    Map<Holding, BigInteger> staged = new HashMap<>();
    for (TokenTransfer transfer : transfers) {
      if (transfer.amount().signum() == 0) {
        continue;
      }
      Holding from = new Holding(transfer.from(), transfer.asset());
      Holding to = new Holding(transfer.to(), transfer.asset());
      BigInteger available = staged.getOrDefault(from, balances.getOrDefault(from, BigInteger.ZERO));
      if (available.compareTo(transfer.amount()) < 0) {
        throw new SettlementException("insufficient " + transfer.asset() + " balance for " + transfer.from()
            + ": requested=" + transfer.amount() + ", available=" + available);
      }
      staged.put(from, available.subtract(transfer.amount()));
      BigInteger credited = staged.getOrDefault(to, balances.getOrDefault(to, BigInteger.ZERO));
      staged.put(to, Uint256Math.add(credited, transfer.amount()));
    }
    balances.putAll(staged);
    log.debug("paper transfers applied (count={}, holdingsTouched={})", transfers.size(), staged.size());
  }

  private record Holding(Address owner, Address asset) {
  }
}
