package com.meshx.exchange.service.events;

import com.meshx.exchange.events.ExchangeEvent;
import com.meshx.exchange.events.ExchangeEventSink;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class MeteredExchangeEventSink implements ExchangeEventSink {

  static final String METRIC_NAME = "exchange.events";

  private final @NonNull MeterRegistry meterRegistry;

  @Override
  public void publish(ExchangeEvent event) {
    meterRegistry.counter(METRIC_NAME, "type", event.type()).increment();
  }
}
