package com.meshx.exchange.math;

import com.meshx.exchange.error.ExchangeError;
import com.meshx.exchange.error.ExchangeException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Uint256MathTest {

  @Test
  void addFailsPastMax() {
    assertThat(Uint256Math.add(Uint256Math.MAX.subtract(BigInteger.ONE), BigInteger.ONE)).isEqualTo(Uint256Math.MAX);
    assertThatThrownBy(() -> Uint256Math.add(Uint256Math.MAX, BigInteger.ONE))
        .isInstanceOfSatisfying(ExchangeException.class,
            e -> assertThat(e.error()).isEqualTo(ExchangeError.ARITHMETIC_OVERFLOW));
  }

  @Test
  void subFailsBelowZero() {
    assertThat(Uint256Math.sub(BigInteger.TEN, BigInteger.TEN)).isZero();
    assertThatThrownBy(() -> Uint256Math.sub(BigInteger.ONE, BigInteger.TWO))
        .isInstanceOfSatisfying(ExchangeException.class,
            e -> assertThat(e.error()).isEqualTo(ExchangeError.ARITHMETIC_UNDERFLOW));
  }

  @Test
  void mulFailsPastMax() {
    BigInteger half = BigInteger.ONE.shiftLeft(128);
    assertThatThrownBy(() -> Uint256Math.mul(half, half))
        .isInstanceOfSatisfying(ExchangeException.class,
            e -> assertThat(e.error()).isEqualTo(ExchangeError.ARITHMETIC_OVERFLOW));
    assertThat(Uint256Math.mul(half, half.subtract(BigInteger.ONE)).bitLength()).isEqualTo(256);
  }

  @Test
  void divisionByZeroIsRejected() {
    assertThatThrownBy(() -> Uint256Math.div(BigInteger.TEN, BigInteger.ZERO))
        .isInstanceOfSatisfying(ExchangeException.class,
            e -> assertThat(e.error()).isEqualTo(ExchangeError.DIVISION_BY_ZERO));
    assertThatThrownBy(() -> Uint256Math.mulmod(BigInteger.TEN, BigInteger.TEN, BigInteger.ZERO))
        .isInstanceOf(ExchangeException.class);
  }

  @Test
  void mulmodUsesTheFullWidthProduct() {
    BigInteger seven = BigInteger.valueOf(7);
    assertThat(Uint256Math.mulmod(Uint256Math.MAX, Uint256Math.MAX, seven))
        .isEqualTo(Uint256Math.MAX.multiply(Uint256Math.MAX).mod(seven));
  }

  @Test
  void rejectsOperandsOutsideTheRange() {
    assertThat(Uint256Math.isUint256(BigInteger.ONE.negate())).isFalse();
    assertThat(Uint256Math.isUint256(Uint256Math.MAX.add(BigInteger.ONE))).isFalse();
    assertThat(Uint256Math.isUint256(null)).isFalse();
    assertThatThrownBy(() -> Uint256Math.add(BigInteger.ONE.negate(), BigInteger.TEN))
        .isInstanceOf(ExchangeException.class);
  }
}
