package com.oddsdata.gamesync.application.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Configuration for the external resolver integration
 * 
 * Configuration via application.yml:
 *   app.resolver.type: "rest" | "none" (default: "none")
 *   app.resolver.url: "http://game-resolver:8085/api/resolve" (for REST)
 */
@Configuration
public class ResolverClientConfig {
    
    /**
     * RestTemplate for the resolver client, configured with timeouts
     */
    @Bean(name = "resolverRestTemplate")
    public RestTemplate resolverRestTemplate(
            @Value("${app.resolver.connect-timeout:PT5S}") Duration connectTimeout,
            @Value("${app.resolver.read-timeout:PT10S}") Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) connectTimeout.toMillis());
        factory.setReadTimeout((int) readTimeout.toMillis());
        
        return new RestTemplate(factory);
    }
}
