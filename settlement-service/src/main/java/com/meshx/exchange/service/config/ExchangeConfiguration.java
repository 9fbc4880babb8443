package com.meshx.exchange.service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meshx.exchange.config.ExchangeProperties;
import com.meshx.exchange.crypto.PersonalMessageSignatureVerifier;
import com.meshx.exchange.crypto.SignatureVerifier;
import com.meshx.exchange.events.ExchangeEventSink;
import com.meshx.exchange.ledger.FillLedger;
import com.meshx.exchange.ledger.InMemoryFillLedger;
import com.meshx.exchange.service.events.LoggingExchangeEventSink;
import com.meshx.exchange.service.events.MeteredExchangeEventSink;
import com.meshx.exchange.service.settlement.InMemoryTokenVault;
import com.meshx.exchange.service.settlement.PaperSettlementProperties;
import com.meshx.exchange.service.settlement.TokenTransferSettlement;
import com.meshx.exchange.settlement.AssetSettlement;
import com.meshx.exchange.settlement.SettlementCore;
import com.meshx.exchange.tx.MetaTransactionGate;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.abi.datatypes.Address;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Configuration(proxyBeanMethods = false)
@Slf4j
public class ExchangeConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public MeterRegistry meterRegistry() {
    return new SimpleMeterRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public FillLedger fillLedger() {
    return new InMemoryFillLedger();
  }

  @Bean
  @ConditionalOnMissingBean
  public SignatureVerifier signatureVerifier() {
    return new PersonalMessageSignatureVerifier();
  }

  @Bean
  public InMemoryTokenVault inMemoryTokenVault(PaperSettlementProperties paper) {
    InMemoryTokenVault vault = new InMemoryTokenVault();
    for (PaperSettlementProperties.Balance balance : paper.balances()) {
      vault.deposit(new Address(balance.owner()), new Address(balance.asset()), balance.amount());
    }
    log.info("paper vault seeded (balances={}, feeAsset={})", paper.balances().size(), paper.feeAssetAddress());
    return vault;
  }

  @Bean
  @ConditionalOnMissingBean
  public AssetSettlement assetSettlement(InMemoryTokenVault vault, PaperSettlementProperties paper) {
    return new TokenTransferSettlement(vault, new Address(paper.feeAssetAddress()));
  }

  @Bean
  public ExchangeEventSink exchangeEventSink(
      ExchangeProperties properties,
      ObjectProvider<ObjectMapper> objectMapper,
      MeterRegistry meterRegistry
  ) {
    List<ExchangeEventSink> sinks = new ArrayList<>(2);
    if (properties.events().jsonLog()) {
      sinks.add(new LoggingExchangeEventSink(objectMapper.getIfAvailable(ObjectMapper::new)));
    }
    if (properties.events().metrics()) {
      sinks.add(new MeteredExchangeEventSink(meterRegistry));
    }
    return sinks.isEmpty() ? ExchangeEventSink.noop() : ExchangeEventSink.composite(sinks);
  }

  @Bean
  public SettlementCore settlementCore(
      ExchangeProperties properties,
      FillLedger fillLedger,
      SignatureVerifier signatureVerifier,
      AssetSettlement assetSettlement,
      ExchangeEventSink exchangeEventSink,
      Clock clock
  ) {
    if (properties.hasDefaultVenue()) {
      log.warn("exchange.venue-address is not set; orders hash against the zero venue");
    }
    Address venue = new Address(properties.venueAddress());
    log.info("settlement core ready (venue={}, jsonLog={}, metrics={})",
        venue, properties.events().jsonLog(), properties.events().metrics());
    return new SettlementCore(venue, fillLedger, signatureVerifier, assetSettlement, exchangeEventSink, clock);
  }

  @Bean
  public MetaTransactionGate metaTransactionGate(
      SettlementCore settlementCore,
      FillLedger fillLedger,
      SignatureVerifier signatureVerifier
  ) {
    return new MetaTransactionGate(settlementCore, fillLedger, signatureVerifier);
  }
}
