package com.meshx.exchange.service.events;

import com.meshx.exchange.events.CancelUpToEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

class MeteredExchangeEventSinkTest {

  @Test
  void countsEventsPerType() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    MeteredExchangeEventSink sink = new MeteredExchangeEventSink(registry);
    Address maker = new Address("0x2c7536e3605d9c16a7a3d7b1898e529396a65c23");

    sink.publish(new CancelUpToEvent(maker, BigInteger.ONE));
    sink.publish(new CancelUpToEvent(maker, BigInteger.TWO));

    assertThat(registry.get(MeteredExchangeEventSink.METRIC_NAME).tag("type", "CancelUpTo").counter().count())
        .isEqualTo(2.0);
    assertThat(registry.find(MeteredExchangeEventSink.METRIC_NAME).tag("type", "Fill").counter()).isNull();
  }
}
