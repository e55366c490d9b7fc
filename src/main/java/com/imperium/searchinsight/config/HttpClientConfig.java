package com.imperium.searchinsight.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class HttpClientConfig {

    /**
     * provider 共用的 RestTemplate。HTTP 层超时之外，网关还会在调用链上再加一层超时。
     */
    @Bean(name = "searchRestTemplate")
    public RestTemplate searchRestTemplate(
            @Value("${app.search.http.connect-timeout-ms:3000}") int connectTimeoutMs,
            @Value("${app.search.http.read-timeout-ms:8000}") int readTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(factory);
    }
}
