package com.oddsdata.gamesync.infrastructure.resolver;

import com.oddsdata.gamesync.domain.enums.GameSource;
import com.oddsdata.gamesync.domain.enums.MatchConfidence;
import com.oddsdata.gamesync.domain.model.ResolverMatch;
import com.oddsdata.gamesync.domain.resolver.ExternalGameResolver;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.LocalDate;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * External game resolver that calls the resolver service over REST.
 * Any failure, including an open breaker, is reported as no match.
 *
 * Configuration:
 * - app.resolver.type: "rest"
 * - app.resolver.url: "http://game-resolver:8085/api/resolve"
 */
@Component
@ConditionalOnProperty(
        name = "app.resolver.type",
        havingValue = "rest",
        matchIfMissing = false
)
public class ResolverServiceClient implements ExternalGameResolver {
    
    private static final Logger log = LoggerFactory.getLogger(ResolverServiceClient.class);
    
    static final String MATCH_METHOD_FAILED = "resolver_unavailable";
    
    private final RestTemplate restTemplate;
    private final String resolverUrl;
    private final CircuitBreaker circuitBreaker;
    
    public ResolverServiceClient(
            @Qualifier("resolverRestTemplate") RestTemplate restTemplate,
            @Value("${app.resolver.url:http://localhost:8085/api/resolve}") String resolverUrl,
            @Qualifier("externalResolverCircuitBreaker") CircuitBreaker circuitBreaker) {
        this.restTemplate = restTemplate;
        this.resolverUrl = resolverUrl;
        this.circuitBreaker = circuitBreaker;
    }
    
    @Override
    public ResolverMatch resolve(String externalId, GameSource source, String homeTeam, String awayTeam,
                                 LocalDate gameDate) {
        ResolveRequest request = new ResolveRequest(externalId, source.getTag(), homeTeam, awayTeam,
                gameDate != null ? gameDate.toString() : null);
        
        Supplier<ResolverMatch> supplier = () -> {
            try {
                log.debug("Resolving {}:{} ({} @ {}, {}) via {}", source, externalId, awayTeam, homeTeam, gameDate,
                        resolverUrl);
                ResponseEntity<ResolveResponse> response =
                        restTemplate.postForEntity(resolverUrl, request, ResolveResponse.class);
                
                if (response.getStatusCode() == HttpStatus.OK && response.getBody() != null) {
                    return toMatch(response.getBody());
                }
                log.warn("Resolver returned {} for {}:{}", response.getStatusCode(), source, externalId);
                return ResolverMatch.none(MATCH_METHOD_FAILED);
                
            } catch (ResourceAccessException e) {
                log.error("Timeout or connection error calling resolver for {}:{}: {}", source, externalId,
                        e.getMessage());
                throw new IllegalStateException("Resolver service unavailable", e);
            } catch (RestClientException e) {
                log.error("Error calling resolver for {}:{}: {}", source, externalId, e.getMessage());
                throw new IllegalStateException("Resolver service error", e);
            }
        };
        
        try {
            return circuitBreaker.executeSupplier(supplier);
        } catch (Exception e) {
            log.warn("Resolver call failed for {}:{}, treating as no match: {}", source, externalId, e.getMessage());
            return ResolverMatch.none(MATCH_METHOD_FAILED);
        }
    }
    
    static ResolverMatch toMatch(ResolveResponse body) {
        MatchConfidence confidence;
        try {
            confidence = body.getConfidence() != null
                    ? MatchConfidence.valueOf(body.getConfidence().trim().toUpperCase(Locale.ROOT))
                    : MatchConfidence.NONE;
        } catch (IllegalArgumentException e) {
            log.warn("Resolver returned unknown confidence '{}', treating as no match", body.getConfidence());
            confidence = MatchConfidence.NONE;
        }
        return new ResolverMatch(body.getCanonicalId(), confidence, body.getMatchMethod());
    }
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class ResolveRequest {
        private String externalId;
        private String source;
        private String homeTeam;
        private String awayTeam;
        private String gameDate;
    }
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class ResolveResponse {
        private String canonicalId;
        private String confidence;
        private String matchMethod;
    }
}
