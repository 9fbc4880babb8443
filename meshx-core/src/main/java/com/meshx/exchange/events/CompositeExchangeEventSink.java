package com.meshx.exchange.events;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Fans each event out to every delegate. A delegate that throws is logged and skipped; the rest
 * still receive the event.
 */
@Slf4j
public class CompositeExchangeEventSink implements ExchangeEventSink {

  private final List<ExchangeEventSink> sinks;

  public CompositeExchangeEventSink(@NonNull List<ExchangeEventSink> sinks) {
    this.sinks = List.copyOf(sinks);
  }

  @Override
  public void publish(ExchangeEvent event) {
    for (ExchangeEventSink sink : sinks) {
      try {
        sink.publish(event);
      } catch (RuntimeException e) {
        log.warn("event sink failed (sink={}, type={}): {}", sink.getClass().getSimpleName(), event.type(), e.toString());
      }
    }
  }
}
