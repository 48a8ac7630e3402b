package com.sparrowlogic.reachability.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ecs.EcsClient;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.rds.RdsClient;

@Configuration
@EnableConfigurationProperties(ReachabilityProperties.class)
public class AwsClientConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AwsClientConfiguration.class);

    private final ReachabilityProperties properties;

    public AwsClientConfiguration(ReachabilityProperties properties) {
        this.properties = properties;
    }

    @Bean
    public AwsCredentialsProvider awsCredentialsProvider() {
        var profile = properties.aws().profile();
        if (profile != null && !profile.isBlank()) {
            log.info("Using AWS credentials profile '{}'", profile);
            return ProfileCredentialsProvider.create(profile);
        }
        return DefaultCredentialsProvider.create();
    }

    @Bean(destroyMethod = "close")
    public Ec2Client ec2Client(AwsCredentialsProvider credentialsProvider) {
        return Ec2Client.builder()
            .credentialsProvider(credentialsProvider)
            .region(region())
            .build();
    }

    @Bean(destroyMethod = "close")
    public LambdaClient lambdaClient(AwsCredentialsProvider credentialsProvider) {
        return LambdaClient.builder()
            .credentialsProvider(credentialsProvider)
            .region(region())
            .build();
    }

    @Bean(destroyMethod = "close")
    public EcsClient ecsClient(AwsCredentialsProvider credentialsProvider) {
        return EcsClient.builder()
            .credentialsProvider(credentialsProvider)
            .region(region())
            .build();
    }

    @Bean(destroyMethod = "close")
    public RdsClient rdsClient(AwsCredentialsProvider credentialsProvider) {
        return RdsClient.builder()
            .credentialsProvider(credentialsProvider)
            .region(region())
            .build();
    }

    private Region region() {
        return Region.of(properties.aws().region());
    }
}
