package com.meshx.exchange.service.settlement;

import com.meshx.exchange.settlement.SettlementException;
import org.junit.jupiter.api.Test;
import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryTokenVaultTest {

  private static final Address ALICE = new Address("0x00000000000000000000000000000000000a11ce");
  private static final Address BOB = new Address("0x0000000000000000000000000000000000000b0b");
  private static final Address TOKEN = new Address("0x1dad4783cf3fe3085c1426157ab175a6119a04ba");
  private static final Address OTHER_TOKEN = new Address("0xe41d2489571d322189246dafa5ebde1f4699f498");

  private final InMemoryTokenVault vault = new InMemoryTokenVault();

  @Test
  void depositsAccumulatePerOwnerAndAsset() {
    vault.deposit(ALICE, TOKEN, BigInteger.valueOf(10));
    vault.deposit(ALICE, TOKEN, BigInteger.valueOf(5));

    assertThat(vault.balanceOf(ALICE, TOKEN)).isEqualTo(15);
    assertThat(vault.balanceOf(ALICE, OTHER_TOKEN)).isZero();
    assertThat(vault.balanceOf(BOB, TOKEN)).isZero();
  }

  @Test
  void batchMovesBalances() throws Exception {
    vault.deposit(ALICE, TOKEN, BigInteger.valueOf(10));
    vault.deposit(BOB, OTHER_TOKEN, BigInteger.valueOf(3));

    vault.transferAll(List.of(
        new TokenTransfer(TOKEN, ALICE, BOB, BigInteger.valueOf(4)),
        new TokenTransfer(OTHER_TOKEN, BOB, ALICE, BigInteger.valueOf(3)),
        new TokenTransfer(TOKEN, ALICE, BOB, BigInteger.ZERO)
    ));

    assertThat(vault.balanceOf(ALICE, TOKEN)).isEqualTo(6);
    assertThat(vault.balanceOf(BOB, TOKEN)).isEqualTo(4);
    assertThat(vault.balanceOf(ALICE, OTHER_TOKEN)).isEqualTo(3);
    assertThat(vault.balanceOf(BOB, OTHER_TOKEN)).isZero();
  }

  @Test
  void laterTransferMaySpendEarlierCredit() throws Exception {
    vault.deposit(ALICE, TOKEN, BigInteger.valueOf(5));

    vault.transferAll(List.of(
        new TokenTransfer(TOKEN, ALICE, BOB, BigInteger.valueOf(5)),
        new TokenTransfer(TOKEN, BOB, ALICE, BigInteger.valueOf(2))
    ));

    assertThat(vault.balanceOf(ALICE, TOKEN)).isEqualTo(2);
    assertThat(vault.balanceOf(BOB, TOKEN)).isEqualTo(3);
  }

  @Test
  void shortfallAnywhereAbortsTheWholeBatch() {
    vault.deposit(ALICE, TOKEN, BigInteger.valueOf(10));

    assertThatThrownBy(() -> vault.transferAll(List.of(
        new TokenTransfer(TOKEN, ALICE, BOB, BigInteger.valueOf(10)),
        new TokenTransfer(OTHER_TOKEN, BOB, ALICE, BigInteger.ONE)
    ))).isInstanceOf(SettlementException.class).hasMessageContaining("insufficient");

    assertThat(vault.balanceOf(ALICE, TOKEN)).isEqualTo(10);
    assertThat(vault.balanceOf(BOB, TOKEN)).isZero();
  }
}
