package com.cario.valuation.app.config;

import com.cario.valuation.app.repository.ValuationCacheStore;
import com.cario.valuation.app.repository.dynamodb.DynamoDbValuationCacheStore;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * AWS configuration for the local environment.
 *
 * <p>Uses static credentials from the application properties and backs the valuation cache with
 * DynamoDB. Active only when the {@code local} Spring profile is enabled.
 */
@Configuration
@Profile("local")
@Import({ServiceConfig.class, ChatGptConfig.class, SchedulerConfig.class})
public class AwsLocalConfig {

  /** AWS region in which the clients will operate. */
  @Value("${aws.region}")
  private String region;

  /** AWS access key ID for local development. */
  @Value("${aws.accessKeyId}")
  private String accessKeyId;

  /** AWS secret access key for local development. */
  @Value("${aws.secretAccessKey}")
  private String secretAccessKey;

  @Bean
  StaticCredentialsProvider awsCreds() {
    return StaticCredentialsProvider.create(
        AwsBasicCredentials.create(accessKeyId, secretAccessKey));
  }

  /**
   * Creates an Amazon DynamoDB client using static credentials.
   *
   * @return a configured {@link DynamoDbClient} for the specified AWS region.
   */
  @Bean
  public DynamoDbClient dynamoDbClient(StaticCredentialsProvider awsCreds) {
    return DynamoDbClient.builder().region(Region.of(region)).credentialsProvider(awsCreds).build();
  }

  @Bean
  public ValuationCacheStore valuationCacheStore(
      DynamoDbClient ddb, ValuationProperties props, Clock clock) {
    return new DynamoDbValuationCacheStore(
        ddb, props.getCache().getTableName(), props.getCache().getValidity(), clock);
  }
}
