package com.edwardjones.personnelsync.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.web.client.RestTemplateBuilderConfigurer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;

@Configuration
public class ApiClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApiClientConfig.class);

    /**
     * Builder shared by the HTTP adapters. Every adapter request is bounded by the configured
     * connect and read timeouts so a hanging call cannot stall the apply phase forever.
     */
    @Bean
    public RestTemplateBuilder restTemplateBuilder(RestTemplateBuilderConfigurer configurer, SyncProperties properties) {
        SyncProperties.Http http = properties.getHttp();
        logger.info("Initializing adapter RestTemplateBuilder with connect timeout {} and read timeout {}",
                http.getConnectTimeout(), http.getReadTimeout());
        return configurer.configure(new RestTemplateBuilder())
                .setConnectTimeout(http.getConnectTimeout())
                .setReadTimeout(http.getReadTimeout())
                .additionalInterceptors(loggingInterceptor());
    }

    private ClientHttpRequestInterceptor loggingInterceptor() {
        return (request, body, execution) -> {
            // Query strings may carry API keys, so only the path is logged
            logger.debug("Adapter request: {} {}{}", request.getMethod(), request.getURI().getHost(), request.getURI().getPath());
            var response = execution.execute(request, body);
            logger.debug("Adapter response status: {}", response.getStatusCode());
            return response;
        };
    }
}
