package com.meshx.exchange.service.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.meshx.exchange.events.ExchangeEvent;
import com.meshx.exchange.events.ExchangeEventSink;
import com.meshx.exchange.ledger.TransactionHash;
import com.meshx.exchange.order.OrderHash;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;

/**
 * Writes each event as one JSON line: {@code {"type":"Fill","payload":{...}}}. Addresses and
 * hashes render as hex, amounts as decimal strings so uint256 values survive JSON readers.
 */
@Slf4j
public class LoggingExchangeEventSink implements ExchangeEventSink {

  private final ObjectMapper objectMapper;

  public LoggingExchangeEventSink(@NonNull ObjectMapper objectMapper) {
    SimpleModule hexValues = new SimpleModule("meshx-hex-values")
        .addSerializer(Address.class, ToStringSerializer.instance)
        .addSerializer(OrderHash.class, ToStringSerializer.instance)
        .addSerializer(TransactionHash.class, ToStringSerializer.instance)
        .addSerializer(BigInteger.class, ToStringSerializer.instance);
    this.objectMapper = objectMapper.copy().registerModule(hexValues);
  }

  @Override
  public void publish(ExchangeEvent event) {
    log.info("{}", render(event));
  }

  String render(ExchangeEvent event) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put("type", event.type());
    node.set("payload", objectMapper.valueToTree(event));
    try {
      return objectMapper.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("cannot serialize " + event.type() + " event", e);
    }
  }
}
