package com.autobudget.config;

import com.autobudget.remote.HttpRemoteAdsApi;
import com.autobudget.remote.RemoteAdsApi;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Wires the remote ads API client and the HTTP template used for the channel directory.
 *
 * <p>The {@link RemoteAdsApi} bean only exists when {@code autobudget.remote.base-url} is
 * set. Consumers inject {@code Optional<RemoteAdsApi>} and branch on presence.
 */
@Configuration
public class RemoteApiConfig {

    @Bean
    @ConditionalOnExpression("!'${autobudget.remote.base-url:}'.isBlank()")
    public RemoteAdsApi remoteAdsApi(
            RestTemplateBuilder restTemplateBuilder, AutoBudgetConfig autoBudgetConfig, ObjectMapper objectMapper) {
        AutoBudgetConfig.Remote remote = autoBudgetConfig.getRemote();
        RestTemplate restTemplate = restTemplateBuilder
                .connectTimeout(remote.getTimeout())
                .readTimeout(remote.getTimeout())
                .build();
        return new HttpRemoteAdsApi(restTemplate, remote, objectMapper);
    }

    @Bean("directoryRestTemplate")
    public RestTemplate directoryRestTemplate(
            RestTemplateBuilder restTemplateBuilder, AutoBudgetConfig autoBudgetConfig) {
        AutoBudgetConfig.Directory directory = autoBudgetConfig.getDirectory();
        return restTemplateBuilder
                .connectTimeout(directory.getTimeout())
                .readTimeout(directory.getTimeout())
                .build();
    }
}
