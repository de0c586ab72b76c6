package com.darksite.metering.config;

import com.darksite.metering.adapters.EndpointAdapter;
import com.darksite.metering.adapters.OutboundRateLimiter;
import com.darksite.metering.adapters.RetryPolicy;
import com.darksite.metering.domain.model.ApiGeneration;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.client5.http.io.HttpClientConnectionManager;
import org.apache.hc.client5.http.ssl.NoopHostnameVerifier;
import org.apache.hc.client5.http.ssl.SSLConnectionSocketFactoryBuilder;
import org.apache.hc.client5.http.ssl.TrustAllStrategy;
import org.apache.hc.core5.ssl.SSLContextBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the control-plane adapters and their HTTP stack.
 */
@Configuration
@Slf4j
public class AdapterConfig {

    @Bean
    public Map<ApiGeneration, EndpointAdapter> endpointAdapters(List<EndpointAdapter> adapters) {
        var byGeneration = new EnumMap<ApiGeneration, EndpointAdapter>(ApiGeneration.class);
        for (EndpointAdapter adapter : adapters) {
            if (byGeneration.put(adapter.getGeneration(), adapter) != null) {
                throw new IllegalStateException("Two adapters for " + adapter.getGeneration());
            }
        }
        return byGeneration;
    }

    /**
     * Pooled HTTP client on HttpClient 5. Certificate checks are skipped when
     * {@code metering.prism.verify-ssl} is false.
     */
    @Bean
    public RestTemplate restTemplate(MeteringProperties properties) {
        MeteringProperties.Prism prism = properties.getPrism();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager(prism))
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.of(prism.getReadTimeout()))
                        .build())
                .disableCookieManagement()
                .build();

        return new RestTemplate(new HttpComponentsClientHttpRequestFactory(httpClient));
    }

    @Bean
    public RetryPolicy retryPolicy(MeteringProperties properties) {
        MeteringProperties.Collection collection = properties.getCollection();
        return new RetryPolicy(collection.getMaxAttempts(), collection.getInitialBackoff(),
                collection.getBackoffMultiplier());
    }

    @Bean
    public OutboundRateLimiter outboundRateLimiter(MeteringProperties properties) {
        return new OutboundRateLimiter(properties.getRateLimit().getRequestsPerSecond());
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    private static HttpClientConnectionManager connectionManager(MeteringProperties.Prism prism) {
        var builder = PoolingHttpClientConnectionManagerBuilder.create()
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(Timeout.of(prism.getConnectTimeout()))
                        .setSocketTimeout(Timeout.of(prism.getReadTimeout()))
                        .build());

        if (!prism.isVerifySsl()) {
            log.warn("TLS certificate verification disabled for {}", prism.getHost());
            try {
                builder.setSSLSocketFactory(SSLConnectionSocketFactoryBuilder.create()
                        .setSslContext(SSLContextBuilder.create()
                                .loadTrustMaterial(TrustAllStrategy.INSTANCE)
                                .build())
                        .setHostnameVerifier(NoopHostnameVerifier.INSTANCE)
                        .build());
            } catch (GeneralSecurityException e) {
                throw new IllegalStateException("Cannot build trust-all TLS context", e);
            }
        }
        return builder.build();
    }
}
