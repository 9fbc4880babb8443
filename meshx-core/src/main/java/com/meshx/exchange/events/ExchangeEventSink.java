package com.meshx.exchange.events;

import java.util.List;

@FunctionalInterface
public interface ExchangeEventSink {

  void publish(ExchangeEvent event);

  static ExchangeEventSink noop() {
    return event -> {
    };
  }

  static ExchangeEventSink composite(List<ExchangeEventSink> sinks) {
    return new CompositeExchangeEventSink(sinks);
  }
}
