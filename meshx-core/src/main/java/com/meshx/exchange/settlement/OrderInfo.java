package com.meshx.exchange.settlement;

import com.meshx.exchange.order.OrderHash;

import java.math.BigInteger;

public record OrderInfo(
    OrderHash orderHash,
    OrderStatus status,
    BigInteger filledAmount,
    BigInteger cancelledAmount,
    BigInteger remainingAmount
) {
}
