package com.flagship.finance_automation.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * One RestTemplate per external system, each with its own connect and read timeouts.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate trueLayerRestTemplate(RestTemplateBuilder builder, FinanceProperties properties) {
        return builder
                .setConnectTimeout(properties.getTruelayer().getConnectTimeout())
                .setReadTimeout(properties.getTruelayer().getReadTimeout())
                .build();
    }

    @Bean
    public RestTemplate monzoRestTemplate(RestTemplateBuilder builder, FinanceProperties properties) {
        return builder
                .setConnectTimeout(properties.getMonzo().getConnectTimeout())
                .setReadTimeout(properties.getMonzo().getReadTimeout())
                .build();
    }

    @Bean
    public RestTemplate homeAssistantRestTemplate(RestTemplateBuilder builder, FinanceProperties properties) {
        return builder
                .setConnectTimeout(properties.getHomeAssistant().getConnectTimeout())
                .setReadTimeout(properties.getHomeAssistant().getReadTimeout())
                .build();
    }
}
