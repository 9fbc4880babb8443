package com.meshx.exchange.service.settlement;

import com.meshx.exchange.order.Order;
import com.meshx.exchange.settlement.SettlementException;
import com.meshx.exchange.settlement.SettlementResult;
import org.junit.jupiter.api.Test;
import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenTransferSettlementTest {

  private static final Address MAKER = new Address("0x2c7536e3605d9c16a7a3d7b1898e529396a65c23");
  private static final Address TAKER = new Address("0x00000000000000000000000000000000000a11ce");
  private static final Address FEE_RECIPIENT = new Address("0x0000000000000000000000000000000000000fee");
  private static final Address MAKER_ASSET = new Address("0x1dad4783cf3fe3085c1426157ab175a6119a04ba");
  private static final Address TAKER_ASSET = new Address("0xe41d2489571d322189246dafa5ebde1f4699f498");
  private static final Address FEE_ASSET = new Address("0xe94327d07fc17907b4db788e5adf2ed424addff6");

  private final InMemoryTokenVault vault = new InMemoryTokenVault();
  private final TokenTransferSettlement settlement = new TokenTransferSettlement(vault, FEE_ASSET);

  @Test
  void swapsAssetsAndPaysFees() throws Exception {
    Order order = order().feeRecipientAddress(FEE_RECIPIENT).makerFeeAmount(v(10)).takerFeeAmount(v(20)).build();
    vault.deposit(MAKER, MAKER_ASSET, v(200));
    vault.deposit(MAKER, FEE_ASSET, v(10));
    vault.deposit(TAKER, TAKER_ASSET, v(100));
    vault.deposit(TAKER, FEE_ASSET, v(20));

    SettlementResult result = settlement.settle(order, TAKER, v(50));

    assertThat(result).isEqualTo(new SettlementResult(v(100), v(5), v(10)));
    assertThat(vault.balanceOf(TAKER, MAKER_ASSET)).isEqualTo(100);
    assertThat(vault.balanceOf(MAKER, MAKER_ASSET)).isEqualTo(100);
    assertThat(vault.balanceOf(MAKER, TAKER_ASSET)).isEqualTo(50);
    assertThat(vault.balanceOf(TAKER, TAKER_ASSET)).isEqualTo(50);
    assertThat(vault.balanceOf(FEE_RECIPIENT, FEE_ASSET)).isEqualTo(15);
  }

  @Test
  void noFeesWithoutRecipient() throws Exception {
    Order order = order().makerFeeAmount(v(10)).takerFeeAmount(v(20)).build();
    vault.deposit(MAKER, MAKER_ASSET, v(200));
    vault.deposit(TAKER, TAKER_ASSET, v(100));

    SettlementResult result = settlement.settle(order, TAKER, v(100));

    assertThat(result.makerFeePaid()).isZero();
    assertThat(result.takerFeePaid()).isZero();
    assertThat(vault.balanceOf(TAKER, MAKER_ASSET)).isEqualTo(200);
  }

  @Test
  void missingTakerFundsMovesNothing() {
    Order order = order().build();
    vault.deposit(MAKER, MAKER_ASSET, v(200));
    vault.deposit(TAKER, TAKER_ASSET, v(10));

    assertThatThrownBy(() -> settlement.settle(order, TAKER, v(50))).isInstanceOf(SettlementException.class);

    assertThat(vault.balanceOf(MAKER, MAKER_ASSET)).isEqualTo(200);
    assertThat(vault.balanceOf(TAKER, MAKER_ASSET)).isZero();
  }

  private static Order.OrderBuilder order() {
    return Order.builder()
        .makerAddress(MAKER)
        .makerAssetAddress(MAKER_ASSET)
        .takerAssetAddress(TAKER_ASSET)
        .makerAssetAmount(v(200))
        .takerAssetAmount(v(100))
        .expirationTimeSeconds(v(4_000_000_000L))
        .salt(v(1));
  }

  private static BigInteger v(long value) {
    return BigInteger.valueOf(value);
  }
}
