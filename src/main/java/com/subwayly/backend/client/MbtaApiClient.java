package com.subwayly.backend.client;

import com.subwayly.backend.exception.UpstreamFetchException;
import com.subwayly.backend.model.MbtaRoutesResponse;
import com.subwayly.backend.model.MbtaStopsResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * WebClient wrapper around the MBTA v3 API.
 *
 * <p>Transient statuses (429 and 5xx gateway errors), connection failures and
 * per-attempt timeouts are retried with exponential backoff. Every other failure, and any document missing the fields the network
 * needs, is reported as {@link UpstreamFetchException}.
 */
@Component
@Slf4j
public class MbtaApiClient implements MbtaApi {

        static final String JSON_API = "application/vnd.api+json";

        private static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);

        private final WebClient webClient;
        private final MbtaRateLimiter rateLimiter;
        private final int apiTimeout;
        private final int maxRetries;
        private final long backoffMs;

        public MbtaApiClient(WebClient.Builder webClientBuilder, MbtaRateLimiter rateLimiter,
                        @Value("${mbta.api.base-url:https://api-v3.mbta.com}") String baseUrl,
                        @Value("${mbta.api.key:}") String apiKey,
                        @Value("${mbta.api.timeout:10}") int apiTimeout,
                        @Value("${mbta.api.max-retries:3}") int maxRetries,
                        @Value("${mbta.api.backoff-ms:300}") long backoffMs) {
                this.rateLimiter = rateLimiter;
                this.apiTimeout = apiTimeout;
                this.maxRetries = maxRetries;
                this.backoffMs = backoffMs;

                WebClient.Builder builder = webClientBuilder
                                .baseUrl(baseUrl)
                                .defaultHeader(HttpHeaders.ACCEPT, JSON_API)
                                .codecs(configurer -> configurer
                                                .defaultCodecs()
                                                .maxInMemorySize(2 * 1024 * 1024)); // 2MB
                if (apiKey != null && !apiKey.isBlank()) {
                        builder.defaultHeader("x-api-key", apiKey);
                } else {
                        log.warn("⚠️ No MBTA API key configured, requests are limited to 20 per minute");
                }
                this.webClient = builder.build();
        }

        @Override
        public MbtaRoutesResponse getRoutes(List<Integer> routeTypes) {
                String typeFilter = routeTypes.stream()
                                .map(String::valueOf)
                                .collect(Collectors.joining(","));
                MbtaRoutesResponse response = get(uriBuilder -> uriBuilder
                                .path("/routes")
                                .queryParam("filter[type]", typeFilter)
                                .build(), MbtaRoutesResponse.class, "routes");

                if (response == null || response.getData() == null) {
                        throw new UpstreamFetchException("Routes response is missing 'data'");
                }
                for (MbtaRoutesResponse.RouteData route : response.getData()) {
                        if (route.getId() == null || route.getAttributes() == null
                                        || route.getAttributes().getLongName() == null) {
                                throw new UpstreamFetchException("Route entry is missing id or long_name: " + route);
                        }
                }
                return response;
        }

        @Override
        public MbtaStopsResponse getStops(String routeId) {
                MbtaStopsResponse response = get(uriBuilder -> uriBuilder
                                .path("/stops")
                                .queryParam("filter[route]", routeId)
                                .build(), MbtaStopsResponse.class, "stops of " + routeId);

                if (response == null || response.getData() == null) {
                        throw new UpstreamFetchException("Stops response for route " + routeId + " is missing 'data'");
                }
                for (MbtaStopsResponse.StopData stop : response.getData()) {
                        if (stop.getId() == null || stop.getAttributes() == null
                                        || stop.getAttributes().getName() == null) {
                                throw new UpstreamFetchException("Stop entry is missing id or name: " + stop);
                        }
                }
                return response;
        }

        private <T> T get(Function<UriBuilder, URI> uriFunction, Class<T> type, String what) {
                try {
                        // each attempt waits for its own permit and gets its own time limit
                        return Mono.defer(() -> {
                                                rateLimiter.acquire();
                                                return webClient.get()
                                                                .uri(uriFunction)
                                                                .retrieve()
                                                                .bodyToMono(type)
                                                                .timeout(Duration.ofSeconds(apiTimeout));
                                        })
                                        .retryWhen(Retry.backoff(maxRetries, Duration.ofMillis(backoffMs))
                                                        .filter(this::isRetryable)
                                                        .doBeforeRetry(signal -> log.warn(
                                                                        "⚠️ MBTA request for {} failed ({}), retry {}/{}",
                                                                        what, signal.failure().getMessage(),
                                                                        signal.totalRetries() + 1, maxRetries))
                                                        .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
                                        .block();
                } catch (WebClientResponseException e) {
                        throw new UpstreamFetchException(
                                        "MBTA request for " + what + " failed with status " + e.getStatusCode().value(), e);
                } catch (RuntimeException e) {
                        throw new UpstreamFetchException("MBTA request for " + what + " failed: " + e.getMessage(), e);
                }
        }

        private boolean isRetryable(Throwable throwable) {
                if (throwable instanceof TimeoutException || throwable instanceof WebClientRequestException) {
                        return true;
                }
                return throwable instanceof WebClientResponseException
                                && RETRYABLE_STATUSES.contains(((WebClientResponseException) throwable).getStatusCode().value());
        }
}
