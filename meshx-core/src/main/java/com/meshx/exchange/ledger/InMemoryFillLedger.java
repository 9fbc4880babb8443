package com.meshx.exchange.ledger;

import com.meshx.exchange.error.ExchangeError;
import com.meshx.exchange.error.ExchangeException;
import com.meshx.exchange.math.Uint256Math;
import com.meshx.exchange.order.OrderHash;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Process-local ledger. A single lock serializes units of work; each write pushes an undo entry
 * that is replayed in reverse if the outermost unit fails.
 */
@Slf4j
public class InMemoryFillLedger implements FillLedger {

  private final ReentrantLock lock = new ReentrantLock();

  private final Map<OrderHash, FillLedgerEntry> entries = new HashMap<>();
  private final Map<Address, BigInteger> makerEpochs = new HashMap<>();
  private final Set<TransactionHash> executed = new HashSet<>();

  private final Deque<Runnable> undoLog = new ArrayDeque<>();
  private final List<Runnable> commitActions = new ArrayList<>();
  private int depth;

  @Override
  public FillLedgerEntry getEntry(@NonNull OrderHash orderHash) {
    lock.lock();
    try {
      return entries.getOrDefault(orderHash, FillLedgerEntry.EMPTY);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void recordFill(@NonNull OrderHash orderHash, @NonNull BigInteger amount) {
    requireActiveUnit();
    FillLedgerEntry previous = getEntry(orderHash);
    FillLedgerEntry next = new FillLedgerEntry(
        Uint256Math.add(previous.filledAmount(), amount),
        previous.cancelledAmount()
    );
    putEntry(orderHash, previous, next);
  }

  @Override
  public void recordCancel(@NonNull OrderHash orderHash, @NonNull BigInteger amount) {
    requireActiveUnit();
    FillLedgerEntry previous = getEntry(orderHash);
    FillLedgerEntry next = new FillLedgerEntry(
        previous.filledAmount(),
        Uint256Math.add(previous.cancelledAmount(), amount)
    );
    putEntry(orderHash, previous, next);
  }

  @Override
  public BigInteger getMakerEpoch(@NonNull Address maker) {
    lock.lock();
    try {
      return makerEpochs.getOrDefault(maker, BigInteger.ZERO);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void bumpMakerEpoch(@NonNull Address maker, @NonNull BigInteger newEpoch) {
    requireActiveUnit();
    BigInteger current = makerEpochs.get(maker);
    BigInteger effective = current == null ? BigInteger.ZERO : current;
    if (newEpoch.compareTo(effective) <= 0) {
      throw new ExchangeException(ExchangeError.EPOCH_NOT_INCREASING,
          "epoch for " + maker + " is " + effective + ", refusing " + newEpoch);
    }
    makerEpochs.put(maker, newEpoch);
    undoLog.push(() -> {
      if (current == null) {
        makerEpochs.remove(maker);
      } else {
        makerEpochs.put(maker, current);
      }
    });
  }

  @Override
  public boolean isExecuted(@NonNull TransactionHash transactionHash) {
    lock.lock();
    try {
      return executed.contains(transactionHash);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void markExecuted(@NonNull TransactionHash transactionHash) {
    requireActiveUnit();
    if (!executed.add(transactionHash)) {
      throw new ExchangeException(ExchangeError.TRANSACTION_REPLAYED, "transaction " + transactionHash + " already executed");
    }
    undoLog.push(() -> executed.remove(transactionHash));
  }

  @Override
  public <T> T atomically(@NonNull Supplier<T> work) {
    lock.lock();
    try {
      T result;
      depth++;
      try {
        result = work.get();
      } catch (RuntimeException | Error e) {
        if (depth == 1) {
          rollback();
        }
        throw e;
      } finally {
        depth--;
      }
      if (depth > 0) {
        return result;
      }
      undoLog.clear();
      List<Runnable> committed = List.copyOf(commitActions);
      commitActions.clear();
      // still under the lock, so actions run in commit order across threads
      committed.forEach(this::runCommitAction);
      return result;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void afterCommit(@NonNull Runnable action) {
    requireActiveUnit();
    commitActions.add(action);
  }

  private void putEntry(OrderHash orderHash, FillLedgerEntry previous, FillLedgerEntry next) {
    boolean existed = entries.containsKey(orderHash);
    entries.put(orderHash, next);
    undoLog.push(() -> {
      if (existed) {
        entries.put(orderHash, previous);
      } else {
        entries.remove(orderHash);
      }
    });
  }

  private void rollback() {
    int undone = undoLog.size();
    while (!undoLog.isEmpty()) {
      undoLog.pop().run();
    }
    commitActions.clear();
    log.debug("ledger unit rolled back ({} writes undone)", undone);
  }

  private void runCommitAction(Runnable action) {
    try {
      action.run();
    } catch (RuntimeException e) {
      // The unit is already committed; a failing listener cannot undo it.
      log.warn("post-commit action failed: {}", e.toString());
    }
  }

  private void requireActiveUnit() {
    if (!lock.isHeldByCurrentThread() || depth == 0) {
      throw new IllegalStateException("ledger writes must run inside atomically()");
    }
  }
}
