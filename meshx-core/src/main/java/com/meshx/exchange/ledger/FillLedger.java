package com.meshx.exchange.ledger;

import com.meshx.exchange.order.OrderHash;
import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;
import java.util.function.Supplier;

/**
 * Authoritative record of filled and cancelled amounts per order hash, cancellation epochs per
 * maker, and executed meta-transactions.
 * <p>
 * Every write must happen inside {@link #atomically}. A unit either commits all of its writes or,
 * when the work throws, none of them. Units opened while another is active on the same thread join
 * the outer one.
 */
public interface FillLedger {

  FillLedgerEntry getEntry(OrderHash orderHash);

  default BigInteger getFilledAmount(OrderHash orderHash) {
    return getEntry(orderHash).filledAmount();
  }

  default BigInteger getCancelledAmount(OrderHash orderHash) {
    return getEntry(orderHash).cancelledAmount();
  }

  /**
   * {@code filled + cancelled}.
   */
  default BigInteger getUnavailableAmount(OrderHash orderHash) {
    return getEntry(orderHash).unavailableAmount();
  }

  /**
   * Adds {@code amount} to the filled counter. The caller has already capped it to the remainder.
   */
  void recordFill(OrderHash orderHash, BigInteger amount);

  void recordCancel(OrderHash orderHash, BigInteger amount);

  BigInteger getMakerEpoch(Address maker);

  /**
   * Raises the maker's epoch. Fails with {@code EPOCH_NOT_INCREASING} unless {@code newEpoch} is
   * strictly greater than the current one.
   */
  void bumpMakerEpoch(Address maker, BigInteger newEpoch);

  boolean isExecuted(TransactionHash transactionHash);

  /**
   * Fails with {@code TRANSACTION_REPLAYED} when the hash is already present.
   */
  void markExecuted(TransactionHash transactionHash);

  <T> T atomically(Supplier<T> work);

  /**
   * Runs {@code action} once the outermost active unit commits; dropped if it rolls back. Actions of
   * successive units run in the order the units committed.
   */
  void afterCommit(Runnable action);
}
