package com.premiergroup.insights_sync_engine.config;

import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration(proxyBeanMethods = false)
@Log4j2
public class MetaAdsConfig {

    @Value("${meta.ads.access-token}")
    private String accessToken;

    @Value("${meta.ads.api-version:v18.0}")
    private String apiVersion;

    @Value("${meta.ads.base-url:https://graph.facebook.com}")
    private String baseUrl;

    @Value("${meta.ads.ad-account-id}")
    private String adAccountId;

    @Value("${meta.ads.conversion-action-type:purchase}")
    private String conversionActionType;

    @Value("${meta.ads.page-limit:100}")
    private int pageLimit;

    @Value("${meta.ads.max-pages:50}")
    private int maxPages;

    @Value("${meta.ads.connect-timeout:10s}")
    private Duration connectTimeout;

    @Value("${meta.ads.read-timeout:60s}")
    private Duration readTimeout;

    @Bean
    public MetaAdsSettings metaAdsSettings() {
        if (accessToken == null || accessToken.isBlank()) {
            log.warn("meta.ads.access-token is empty; insights requests will be rejected by the Graph API");
        }
        return new MetaAdsSettings(accessToken, apiVersion, baseUrl, adAccountId,
                conversionActionType, pageLimit, maxPages);
    }

    @Bean
    public RestClient metaGraphRestClient(RestClient.Builder builder) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) connectTimeout.toMillis());
        requestFactory.setReadTimeout((int) readTimeout.toMillis());

        return builder
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
