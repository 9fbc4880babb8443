package com.meshx.exchange.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class ExchangePropertiesBindingTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(TestConfig.class);

  @Test
  void bindsVenueAndEventFlags() {
    runner.withPropertyValues(
        "exchange.venue-address=0x90fe2af704b34e0224bf2299c838e04d4dcf1364",
        "exchange.events.json-log=false"
    ).run(context -> {
      ExchangeProperties properties = context.getBean(ExchangeProperties.class);

      assertThat(properties.venueAddress()).isEqualTo("0x90fe2af704b34e0224bf2299c838e04d4dcf1364");
      assertThat(properties.hasDefaultVenue()).isFalse();
      assertThat(properties.events().jsonLog()).isFalse();
      assertThat(properties.events().metrics()).isTrue();
    });
  }

  @Test
  void defaultsToZeroVenueWithAllSinks() {
    runner.run(context -> {
      ExchangeProperties properties = context.getBean(ExchangeProperties.class);

      assertThat(properties.venueAddress()).isEqualTo(ExchangeProperties.ZERO_ADDRESS);
      assertThat(properties.hasDefaultVenue()).isTrue();
      assertThat(properties.events().jsonLog()).isTrue();
      assertThat(properties.events().metrics()).isTrue();
    });
  }

  @Test
  void rejectsMalformedVenue() {
    runner.withPropertyValues("exchange.venue-address=0x1234")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration(proxyBeanMethods = false)
  @EnableConfigurationProperties(ExchangeProperties.class)
  static class TestConfig {
  }
}
