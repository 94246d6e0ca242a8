package com.cario.valuation.app.config;

import com.cario.valuation.app.engine.DealerEconomics;
import com.cario.valuation.app.engine.IdvEngine;
import com.cario.valuation.app.engine.IdvValidator;
import com.cario.valuation.app.engine.MarketIntelligence;
import com.cario.valuation.app.engine.ModelCatalog;
import com.cario.valuation.app.engine.RegionalAdjustment;
import com.cario.valuation.app.engine.ResaleValuationEngine;
import com.cario.valuation.app.engine.ValuationConvergence;
import com.cario.valuation.app.repository.InMemoryValuationCacheStore;
import com.cario.valuation.app.repository.ValuationCacheStore;
import com.cario.valuation.app.service.*;
import java.time.Clock;
import java.time.ZoneId;
import lombok.RequiredArgsConstructor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.io.ResourceLoader;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@RequiredArgsConstructor
public class ServiceConfig {

  private final ValuationProperties props;

  // -------------------
  // Utility
  // -------------------

  @Bean
  public Clock clock() {
    return Clock.system(ZoneId.of(props.getZone()));
  }

  @Bean
  public PromptLoaderService promptLoaderService(ResourceLoader resourceLoader) {
    return new PromptLoaderService(resourceLoader);
  }

  @Bean
  public VehicleNormalizer vehicleNormalizer() {
    return new VehicleNormalizer();
  }

  // -------------------
  // Engines
  // -------------------

  @Bean
  public ResaleValuationEngine resaleValuationEngine() {
    return new ResaleValuationEngine(
        new MarketIntelligence(ModelCatalog.defaults()),
        new RegionalAdjustment(),
        new ValuationConvergence(),
        new DealerEconomics(),
        props.getResale().getAnnualPriceDecay());
  }

  @Bean
  public IdvEngine idvEngine() {
    return new IdvEngine(new IdvValidator());
  }

  // -------------------
  // Collaborators
  // -------------------

  @Bean
  public RcLookupClient rcLookupClient(WebClient.Builder builder) {
    ValuationProperties.RcLookup rc = props.getRcLookup();
    return new SurepassRcLookupClient(
        builder, rc.getBaseUrl(), rc.getApiToken(), rc.getTimeout());
  }

  @Bean
  public PriceDiscoveryClient priceDiscoveryClient(
      ChatClient.Builder chatClientBuilder, PromptLoaderService promptLoaderService) {
    ValuationProperties.PriceDiscovery pd = props.getPriceDiscovery();
    return new AiPriceDiscoveryService(
        chatClientBuilder,
        promptLoaderService,
        pd.getPromptResource(),
        pd.getModel(),
        pd.getTemperature());
  }

  // -------------------
  // Core Services
  // -------------------

  /** Process-local store for runs without a DynamoDB profile. */
  @Bean
  @Profile("!local & !production")
  public ValuationCacheStore inMemoryValuationCacheStore(Clock clock) {
    return new InMemoryValuationCacheStore(props.getCache().getValidity(), clock);
  }

  @Bean
  public ValuationCacheService valuationCacheService(ValuationCacheStore store) {
    return new ValuationCacheService(store);
  }

  @Bean
  public ValuationHistoryService valuationHistoryService(ValuationCacheStore store) {
    return new ValuationHistoryService(store);
  }

  @Bean
  public ValuationService valuationService(
      VehicleNormalizer normalizer,
      RcLookupClient rcLookupClient,
      ResaleValuationEngine engine,
      Clock clock) {
    return new ValuationService(normalizer, rcLookupClient, engine, clock);
  }

  @Bean
  public IdvService idvService(
      RcLookupClient rcLookupClient,
      VehicleNormalizer normalizer,
      PriceDiscoveryClient priceDiscoveryClient,
      IdvEngine engine,
      ValuationCacheService cache,
      Clock clock) {
    return new IdvService(rcLookupClient, normalizer, priceDiscoveryClient, engine, cache, clock);
  }
}
