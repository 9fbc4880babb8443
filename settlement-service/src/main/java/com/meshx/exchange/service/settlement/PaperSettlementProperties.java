package com.meshx.exchange.service.settlement;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigInteger;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "exchange.paper")
public record PaperSettlementProperties(
    /**
     * Token in which maker and taker fees are charged.
     */
    String feeAssetAddress,
    /**
     * Balances credited to the paper vault at startup.
     */
    @Valid List<Balance> balances
) {

  public PaperSettlementProperties {
    if (feeAssetAddress == null || feeAssetAddress.isBlank()) {
      feeAssetAddress = "0x0000000000000000000000000000000000000000";
    }
    balances = balances == null ? List.of() : List.copyOf(balances);
  }

  public record Balance(
      @NotBlank String owner,
      @NotBlank String asset,
      @NotNull @PositiveOrZero BigInteger amount
  ) {
  }
}
