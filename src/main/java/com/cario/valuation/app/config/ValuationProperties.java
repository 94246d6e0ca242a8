package com.cario.valuation.app.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Settings under {@code valuation.*}. */
@Data
@ConfigurationProperties(prefix = "valuation")
public class ValuationProperties {

  /** Zone used to decide "today" for vehicle age. */
  private String zone = "Asia/Kolkata";

  private RcLookup rcLookup = new RcLookup();
  private PriceDiscovery priceDiscovery = new PriceDiscovery();
  private Cache cache = new Cache();
  private Resale resale = new Resale();

  @Data
  public static class RcLookup {
    private String baseUrl = "https://kyc-api.surepass.app/api/v1/rc/rc-v2";
    private String apiToken;
    private Duration timeout = Duration.ofSeconds(10);
  }

  @Data
  public static class PriceDiscovery {
    private String model = "gpt-4o-mini";
    private double temperature = 0.2;
    private String promptResource = "classpath:prompts/price-discovery.json";
  }

  @Data
  public static class Cache {
    private Duration validity = Duration.ofDays(90);
    private String tableName = "VehicleValuationCache";
    private Purge purge = new Purge();
  }

  @Data
  public static class Purge {
    private boolean enabled;
    private String cron = "0 0 3 * * *";
  }

  @Data
  public static class Resale {
    private double annualPriceDecay = 0.03;
  }
}
