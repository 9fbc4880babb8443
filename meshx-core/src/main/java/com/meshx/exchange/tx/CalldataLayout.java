package com.meshx.exchange.tx;

import com.meshx.exchange.crypto.EcSignature;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.util.Arrays;

/**
 * Fixed binary layout of a relayed fill-order call:
 * <pre>
 * selector                                   4
 * senderAddress .. feeRecipientAddress       6 x 32   (address in the low 20 bytes)
 * makerAssetAmount .. salt                   6 x 32   (big-endian uint256)
 * takerAssetFillAmount                       32
 * signature length                           32       (always 65)
 * signature v || r || s                      65
 * </pre>
 */
public final class CalldataLayout {

  public static final String FILL_ORDER_SIGNATURE =
      "fillOrder(address,address,address,address,address,address,"
          + "uint256,uint256,uint256,uint256,uint256,uint256,uint256,bytes)";

  public static final int SELECTOR_LENGTH = 4;
  public static final int WORD_LENGTH = 32;
  public static final int ORDER_FIELD_COUNT = 12;

  /**
   * Selector, order words, fill amount and the signature length word.
   */
  public static final int HEAD_LENGTH = SELECTOR_LENGTH + (ORDER_FIELD_COUNT + 2) * WORD_LENGTH;

  public static final int FILL_ORDER_LENGTH = HEAD_LENGTH + EcSignature.LENGTH;

  private static final byte[] FILL_ORDER_SELECTOR =
      Arrays.copyOf(Numeric.hexStringToByteArray(Hash.sha3String(FILL_ORDER_SIGNATURE)), SELECTOR_LENGTH);

  private CalldataLayout() {
  }

  public static byte[] fillOrderSelector() {
    return FILL_ORDER_SELECTOR.clone();
  }
}
