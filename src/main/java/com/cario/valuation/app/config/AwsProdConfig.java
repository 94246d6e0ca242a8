package com.cario.valuation.app.config;

import com.cario.valuation.app.repository.ValuationCacheStore;
import com.cario.valuation.app.repository.dynamodb.DynamoDbValuationCacheStore;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * AWS configuration for the production profile.
 *
 * <p>Credentials come from the default provider chain (instance role, environment, profile file).
 */
@Configuration
@Profile("production")
@Import({ServiceConfig.class, ChatGptConfig.class, SchedulerConfig.class})
public class AwsProdConfig {

  /**
   * AWS region in which the clients will operate. Injected from the application configuration
   * property {@code aws.region}.
   */
  @Value("${aws.region}")
  private String region;

  /**
   * Creates an Amazon DynamoDB client using the default credentials provider.
   *
   * @return a configured {@link DynamoDbClient} for the specified AWS region.
   */
  @Bean
  public DynamoDbClient dynamoDbClient() {
    return DynamoDbClient.builder()
        .region(Region.of(region))
        .credentialsProvider(DefaultCredentialsProvider.create())
        .build();
  }

  @Bean
  public ValuationCacheStore valuationCacheStore(
      DynamoDbClient ddb, ValuationProperties props, Clock clock) {
    return new DynamoDbValuationCacheStore(
        ddb, props.getCache().getTableName(), props.getCache().getValidity(), clock);
  }
}
