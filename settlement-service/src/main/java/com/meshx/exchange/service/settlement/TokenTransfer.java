package com.meshx.exchange.service.settlement;

import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;

public record TokenTransfer(Address asset, Address from, Address to, BigInteger amount) {
}
