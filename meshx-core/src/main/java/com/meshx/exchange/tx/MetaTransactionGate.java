package com.meshx.exchange.tx;

import com.meshx.exchange.crypto.EcSignature;
import com.meshx.exchange.crypto.SignatureVerifier;
import com.meshx.exchange.error.ExchangeError;
import com.meshx.exchange.error.ExchangeException;
import com.meshx.exchange.ledger.FillLedger;
import com.meshx.exchange.ledger.TransactionHash;
import com.meshx.exchange.math.Uint256Math;
import com.meshx.exchange.settlement.SettlementCore;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.datatypes.Address;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;

/**
 * Executes a call that {@code signer} signed off-chain and a third party relays.
 * <p>
 * The transaction hash {@code keccak256(uint256(nonce) || payload)} is recorded once; a second
 * submission of the same nonce and payload is rejected. The replay mark, the decoded fill and its
 * settlement share one ledger unit, so a hard failure anywhere leaves the transaction unexecuted.
 */
@RequiredArgsConstructor
@Slf4j
public class MetaTransactionGate {

  private final @NonNull SettlementCore settlementCore;
  private final @NonNull FillLedger ledger;
  private final @NonNull SignatureVerifier signatureVerifier;

  public static TransactionHash transactionHash(@NonNull BigInteger nonce, @NonNull byte[] payload) {
    if (!Uint256Math.isUint256(nonce)) {
      throw new ExchangeException(ExchangeError.MALFORMED_CALLDATA, "nonce must be a uint256, got " + nonce);
    }
    ByteArrayOutputStream out = new ByteArrayOutputStream(32 + payload.length);
    out.writeBytes(Numeric.toBytesPadded(nonce, 32));
    out.writeBytes(payload);
    return TransactionHash.of(Hash.sha3(out.toByteArray()));
  }

  public ExecutionOutcome execute(
      @NonNull BigInteger nonce,
      @NonNull Address signer,
      @NonNull byte[] payload,
      EcSignature signature
  ) {
    TransactionHash txHash = transactionHash(nonce, payload);
    try {
      return ledger.atomically(() -> doExecute(txHash, signer, payload, signature));
    } catch (ExchangeException e) {
      log.warn("meta-transaction rejected (txHash={}, signer={}, error={}): {}",
          txHash, signer, e.error(), e.getMessage());
      throw e;
    }
  }

  private ExecutionOutcome doExecute(TransactionHash txHash, Address signer, byte[] payload, EcSignature signature) {
    if (ledger.isExecuted(txHash)) {
      throw new ExchangeException(ExchangeError.TRANSACTION_REPLAYED, "transaction " + txHash + " already executed");
    }
    if (!signatureVerifier.isValidSignature(txHash.toBytes(), signature, signer)) {
      throw new ExchangeException(ExchangeError.INVALID_SIGNATURE,
          "transaction " + txHash + " is not signed by " + signer);
    }
    ledger.markExecuted(txHash);

    if (!CalldataDecoder.isFillOrder(payload)) {
      log.info("meta-transaction accepted without action (txHash={}, selector={})",
          txHash, Numeric.toHexString(CalldataDecoder.selectorOf(payload)));
      return ExecutionOutcome.unsupported(txHash);
    }

    FillOrderArgs args = CalldataDecoder.decodeFillOrderArgs(payload);
    BigInteger filled = settlementCore.fillOrder(args.order(), args.takerAssetFillAmount(), args.signature(), signer);
    return ExecutionOutcome.fill(txHash, settlementCore.hash(args.order()), filled);
  }
}
