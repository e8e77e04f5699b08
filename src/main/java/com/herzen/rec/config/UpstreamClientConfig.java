package com.herzen.rec.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class UpstreamClientConfig {

    @Bean
    public RestClient upstreamRestClient(RestClient.Builder builder, RecommenderProperties properties) {
        RecommenderProperties.Upstream upstream = properties.getUpstream();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(upstream.getConnectTimeout());
        requestFactory.setReadTimeout(upstream.getReadTimeout());
        return builder
                .baseUrl(upstream.getBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
