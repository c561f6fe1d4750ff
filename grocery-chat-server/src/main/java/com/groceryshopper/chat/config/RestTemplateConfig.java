package com.groceryshopper.chat.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.List;

/**
 * RestTemplate used by every generation backend adapter.
 * Connect and read timeouts bound each backend call so a hung backend cannot hold a
 * pipeline worker forever.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate restTemplate(ObjectMapper objectMapper,
                                     @Value("${agent.generation.connect-timeout-ms:5000}") int connectTimeoutMs,
                                     @Value("${agent.generation.read-timeout-ms:120000}") int readTimeoutMs) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);

        RestTemplate restTemplate = new RestTemplate(requestFactory);

        // Local model servers answer with text/plain or application/x-ndjson
        MappingJackson2HttpMessageConverter jsonConverter = new MappingJackson2HttpMessageConverter(objectMapper);
        List<MediaType> supportedMediaTypes = Arrays.asList(
            MediaType.APPLICATION_JSON,
            MediaType.TEXT_PLAIN,
            MediaType.APPLICATION_NDJSON,
            new MediaType("application", "*+json")
        );
        jsonConverter.setSupportedMediaTypes(supportedMediaTypes);
        restTemplate.getMessageConverters().add(0, jsonConverter);

        return restTemplate;
    }
}
