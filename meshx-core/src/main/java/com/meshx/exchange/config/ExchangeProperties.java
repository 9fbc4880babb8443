package com.meshx.exchange.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "exchange")
public record ExchangeProperties(
    /**
     * Address identifying this exchange instance. Bound into every order hash, so orders signed for
     * one venue cannot be filled on another.
     */
    @NotBlank @Pattern(regexp = "^0x[0-9a-fA-F]{40}$") String venueAddress,
    @Valid Events events
) {

  public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

  public ExchangeProperties {
    if (venueAddress == null || venueAddress.isBlank()) {
      venueAddress = ZERO_ADDRESS;
    }
    if (events == null) {
      events = new Events(null, null);
    }
  }

  public boolean hasDefaultVenue() {
    return ZERO_ADDRESS.equalsIgnoreCase(venueAddress);
  }

  public record Events(
      /**
       * Write every emitted record as a JSON log line.
       */
      Boolean jsonLog,
      /**
       * Count emitted records per type in the meter registry.
       */
      Boolean metrics
  ) {
    public Events {
      if (jsonLog == null) {
        jsonLog = true;
      }
      if (metrics == null) {
        metrics = true;
      }
    }
  }
}
