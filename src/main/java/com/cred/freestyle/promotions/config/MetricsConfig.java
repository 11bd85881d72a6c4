package com.cred.freestyle.promotions.config;

import io.micrometer.cloudwatch2.CloudWatchConfig;
import io.micrometer.cloudwatch2.CloudWatchMeterRegistry;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchAsyncClient;

import java.time.Duration;
import java.util.Map;

/**
 * Metrics registry configuration.
 * Publishes to AWS CloudWatch when {@code cloud.aws.cloudwatch.enabled=true};
 * otherwise meters are kept in memory.
 *
 * @author Promotions Team
 */
@Configuration
public class MetricsConfig {

    private static final Logger logger = LoggerFactory.getLogger(MetricsConfig.class);

    private static final String ENABLED_PROPERTY = "cloud.aws.cloudwatch.enabled";

    @Value("${cloud.aws.region:us-east-1}")
    private String awsRegion;

    @Value("${cloud.aws.cloudwatch.namespace:Promotions}")
    private String namespace;

    @Value("${cloud.aws.cloudwatch.batch-size:20}")
    private Integer batchSize;

    @Value("${cloud.aws.cloudwatch.step:PT1M}")
    private String step; // Publish interval (ISO-8601 duration)

    @Bean
    @ConditionalOnProperty(name = ENABLED_PROPERTY, havingValue = "true")
    public CloudWatchAsyncClient cloudWatchAsyncClient() {
        return CloudWatchAsyncClient.builder()
                .region(Region.of(awsRegion))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = ENABLED_PROPERTY, havingValue = "true")
    public MeterRegistry cloudWatchMeterRegistry(CloudWatchAsyncClient cloudWatchAsyncClient) {
        CloudWatchConfig cloudWatchConfig = new CloudWatchConfig() {
            private final Map<String, String> configuration = Map.of(
                    "cloudwatch.namespace", namespace,
                    "cloudwatch.batchSize", String.valueOf(batchSize),
                    "cloudwatch.step", step
            );

            @Override
            public String get(String key) {
                return configuration.get(key);
            }

            @Override
            public String namespace() {
                return namespace;
            }

            @Override
            public int batchSize() {
                return batchSize;
            }

            @Override
            public Duration step() {
                return Duration.parse(step);
            }
        };

        logger.info("Publishing metrics to CloudWatch namespace {} in {}", namespace, awsRegion);
        return new CloudWatchMeterRegistry(cloudWatchConfig, Clock.SYSTEM, cloudWatchAsyncClient);
    }

    @Bean
    @ConditionalOnProperty(name = ENABLED_PROPERTY, havingValue = "false", matchIfMissing = true)
    public MeterRegistry simpleMeterRegistry() {
        logger.info("CloudWatch disabled, keeping metrics in memory");
        return new SimpleMeterRegistry();
    }
}
