package com.meshx.exchange.tx;

import com.meshx.exchange.crypto.EcSignature;
import com.meshx.exchange.order.Order;

import java.math.BigInteger;

public record FillOrderArgs(Order order, BigInteger takerAssetFillAmount, EcSignature signature) {
}
