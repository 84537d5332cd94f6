package com.agencyos.searchsync.config;

import com.agencyos.searchsync.core.collection.CollectionClassifier;
import com.agencyos.searchsync.core.connection.ConnectionManager;
import com.agencyos.searchsync.core.publisher.ChangeEventPublisher;
import com.agencyos.searchsync.core.stream.StreamConnector;
import com.agencyos.searchsync.core.stream.StreamEndpoint;
import com.agencyos.searchsync.jetstream.JetStreamConnector;
import com.agencyos.searchsync.redis.RedisStreamConnector;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.time.Clock;

/**
 * Spring configuration that wires up:
 * - the collection classifier (always)
 * - the streaming-store connector, connection manager and publisher (only when an endpoint is configured)
 * - connection metrics
 *
 * <h2>Inert mode</h2>
 * When no endpoint resolves (see {@link EndpointResolver}) or its scheme is unsupported, the
 * {@link Active} block is skipped entirely. No connection is attempted and the lifecycle hooks
 * return {@code DISABLED} without touching the classifier. Startup never fails because of the
 * streaming store.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link ConnectionManager#start()} runs as the bean's init method and returns immediately.</li>
 *   <li>{@link ConnectionManager#close()} runs on context shutdown and also shuts the connector down,
 *       so the connector bean has no destroy method of its own.</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(SearchSyncProperties.class)
public class SearchSyncConfig {

    private static final Logger log = LoggerFactory.getLogger(SearchSyncConfig.class);

    @Bean
    public CollectionClassifier collectionClassifier(SearchSyncProperties props) {
        return new CollectionClassifier(props.getSuffixes());
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock searchSyncClock() {
        return Clock.systemUTC();
    }

    /**
     * Fallback registry for deployments without an actuator-provided one.
     */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry searchSyncMeterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Configuration(proxyBeanMethods = false)
    @Conditional(EndpointConfiguredCondition.class)
    static class Active {

        @Bean
        public StreamEndpoint searchSyncEndpoint(Environment env) {
            EndpointResolver.Resolved resolved = EndpointResolver.resolve(env)
                    .orElseThrow(() -> new IllegalStateException("endpoint vanished after condition matched"));
            StreamEndpoint endpoint = StreamEndpoint.parse(resolved.url());
            log.info("Search sync: stream endpoint {} (from {})", endpoint.masked(), resolved.key());
            return endpoint;
        }

        @Bean(destroyMethod = "")
        @ConditionalOnMissingBean
        public StreamConnector streamConnector(StreamEndpoint endpoint, SearchSyncProperties props,
                                               ObjectProvider<ObjectMapper> mapper) {
            return switch (endpoint.transport()) {
                case REDIS -> new RedisStreamConnector(
                        endpoint, props.getStream(), props.getTls().isVerifyPeer(), props.getConnectTimeout());
                case JETSTREAM -> new JetStreamConnector(
                        endpoint, props.getStream(), props.getTls().isVerifyPeer(), props.getConnectTimeout(),
                        props.getJetstream().getCredsFile(), mapper.getIfAvailable(ObjectMapper::new));
            };
        }

        @Bean(initMethod = "start", destroyMethod = "close")
        public ConnectionManager connectionManager(StreamConnector connector, SearchSyncProperties props,
                                                   StreamEndpoint endpoint) {
            return new ConnectionManager(connector, props.reconnectPolicy(), endpoint.masked());
        }

        @Bean
        public ChangeEventPublisher changeEventPublisher(CollectionClassifier classifier,
                                                         ConnectionManager connectionManager,
                                                         Clock clock,
                                                         SearchSyncProperties props,
                                                         MeterRegistry meterRegistry) {
            return new ChangeEventPublisher(classifier, connectionManager, clock, props.getAppendTimeout(), meterRegistry);
        }

        @Bean
        public SearchSyncMetrics searchSyncMetrics(ConnectionManager connectionManager, MeterRegistry meterRegistry) {
            SearchSyncMetrics metrics = new SearchSyncMetrics(connectionManager);
            metrics.bindTo(meterRegistry);
            return metrics;
        }
    }
}
