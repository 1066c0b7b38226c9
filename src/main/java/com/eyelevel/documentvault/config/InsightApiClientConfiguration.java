package com.eyelevel.documentvault.config;

import com.eyelevel.documentvault.common.apiclient.authentication.Authentication;
import com.eyelevel.documentvault.common.apiclient.authentication.impl.APIKeyAuthentication;
import com.eyelevel.documentvault.common.json.JsonParser;
import com.eyelevel.documentvault.enrichment.insight.HttpInsightEngine;
import com.eyelevel.documentvault.enrichment.insight.InsightEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Configures the client of the insight service: its {@link WebClient}, API key authentication and the
 * {@link InsightEngine} built on them.
 */
@Slf4j
@Configuration
public class InsightApiClientConfiguration {

    @Bean("insightWebClient")
    public WebClient insightWebClient(VaultProperties properties) {
        String baseUrl = properties.getInsights().getBaseUrl();
        log.info("Initializing insight WebClient with base URL: {}", baseUrl);
        WebClient.Builder builder = WebClient.builder();
        if (StringUtils.hasText(baseUrl)) {
            builder.baseUrl(baseUrl);
        }
        return builder.build();
    }

    @Bean("insightAuthentication")
    public Authentication insightAuthentication(VaultProperties properties) {
        VaultProperties.Insights insights = properties.getInsights();
        log.info("Initializing insight authentication with header name: '{}'", insights.getAuthKeyName());
        if (insights.isEnabled() && !StringUtils.hasText(insights.getAuthKeyValue())) {
            log.warn("Insight API key is not configured. API calls may fail authentication.");
        }
        return new APIKeyAuthentication(insights.getAuthKeyName(), insights.getAuthKeyValue());
    }

    @Bean
    public InsightEngine insightEngine(@Qualifier("insightWebClient") WebClient webClient,
                                       @Qualifier("insightAuthentication") Authentication authentication,
                                       @Qualifier("jacksonJsonParser") JsonParser jsonParser,
                                       VaultProperties properties) {
        VaultProperties.Insights insights = properties.getInsights();
        boolean enabled = insights.isEnabled() && StringUtils.hasText(insights.getBaseUrl());
        if (!enabled) {
            log.info("Insight generation disabled.");
        }
        return new HttpInsightEngine(webClient, authentication, jsonParser, insights.getEndpoint(), enabled);
    }
}
