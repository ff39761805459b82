package com.kawari.proxy.core.rotation;

import com.kawari.proxy.config.BackendConfig;
import com.kawari.proxy.config.DiscoveryConfig;
import com.kawari.proxy.config.KawariProperties;
import com.kawari.proxy.config.RotationProperties;
import com.kawari.proxy.core.constants.RotationStrategy;
import com.kawari.proxy.core.discovery.PublicListDiscovery;
import com.kawari.proxy.core.exceptions.ConfigException;
import com.kawari.proxy.core.transport.DefaultHttpTransport;
import com.kawari.proxy.spi.BackendDiscovery;
import com.kawari.proxy.spi.HttpTransport;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles a {@link RotationEngine} from the YAML properties.
 */
public final class EngineFactory {
    private static final Logger log = LoggerFactory.getLogger(EngineFactory.class);

    private EngineFactory() {
        // Utility class
    }

    /**
     * Builds an engine with the default transport and public-list discovery.
     *
     * @param properties    loaded configuration.
     * @param meterRegistry registry for engine meters.
     * @return a ready engine; the caller closes it.
     * @throws ConfigException      if the configuration is invalid.
     * @throws InterruptedException if interrupted during discovery.
     */
    public static RotationEngine create(KawariProperties properties, MeterRegistry meterRegistry)
            throws InterruptedException {
        RotationConfig config = toRotationConfig(properties.getRotation());
        return create(properties, meterRegistry, new PublicListDiscovery(properties.getDiscovery()),
                new DefaultHttpTransport(config.getRequestTimeout()));
    }

    /**
     * Builds an engine with explicit collaborators.
     *
     * @param properties    loaded configuration.
     * @param meterRegistry registry for engine meters.
     * @param discovery     used only when discovery is enabled.
     * @param transport     transport handed to the engine, closed with it.
     * @return a ready engine.
     * @throws ConfigException      if the configuration is invalid.
     * @throws InterruptedException if interrupted during discovery.
     */
    public static RotationEngine create(KawariProperties properties, MeterRegistry meterRegistry,
            BackendDiscovery discovery, HttpTransport transport) throws InterruptedException {
        RotationConfig config = toRotationConfig(properties.getRotation());
        List<BackendDescriptor> backends = collectBackends(properties, discovery);

        if (config.isRotateBackend() && backends.isEmpty()) {
            log.warn("Backend rotation is enabled but no backends are configured or discovered; "
                    + "requests will be sent directly");
            config = config.toBuilder().rotateBackend(false).build();
        }

        BackendRegistry registry = new BackendRegistry(config.getFailureThreshold(), config.getRecoveryWindow(),
                Clock.systemUTC());
        int added = registry.registerAll(backends);
        IdentityPool identities = identityPool(properties.getRotation(), config);

        log.info("Rotation engine ready: {} backend(s), {} identities, strategy {}, rate limit {}", added,
                identities.size(), config.getStrategy().getLabel(),
                config.getRateLimit() != null ? config.getRateLimit() + "/s" : "none");
        return new RotationEngine(config, identities, registry, transport, meterRegistry);
    }

    /**
     * Converts and validates the rotation section.
     *
     * @param props YAML rotation section.
     * @return the immutable configuration.
     * @throws ConfigException if a value is invalid.
     */
    public static RotationConfig toRotationConfig(RotationProperties props) {
        RotationStrategy strategy;
        try {
            strategy = RotationStrategy.parse(props.getStrategy());
        } catch (IllegalArgumentException e) {
            throw new ConfigException(e.getMessage(), e);
        }
        return RotationConfig.builder()
                .rotateIdentity(props.isRotateIdentity())
                .rotateBackend(props.isRotateBackend())
                .strategy(strategy)
                .verifyTls(props.isVerifyTls())
                .requestTimeout(Duration.ofMillis(props.getRequestTimeout()))
                .maxRetries(props.getMaxRetries())
                .baseRetryDelay(Duration.ofMillis(props.getBaseRetryDelay()))
                .rateLimit(props.getRateLimit())
                .rateLimitMaxWait(props.getRateLimitMaxWait() != null
                        ? Duration.ofMillis(props.getRateLimitMaxWait())
                        : null)
                .defaultHeaders(props.getDefaultHeaders())
                .failureThreshold(props.getFailureThreshold())
                .recoveryWindow(Duration.ofMillis(props.getRecoveryWindow()))
                .maxRedirects(props.getMaxRedirects())
                .build();
    }

    private static List<BackendDescriptor> collectBackends(KawariProperties properties, BackendDiscovery discovery)
            throws InterruptedException {
        List<BackendDescriptor> backends = new ArrayList<>();
        if (properties.getBackends() != null) {
            for (BackendConfig backend : properties.getBackends()) {
                backends.add(backend.toDescriptor());
            }
        }
        DiscoveryConfig discoveryConfig = properties.getDiscovery();
        if (discoveryConfig != null && discoveryConfig.isEnabled()) {
            List<BackendDescriptor> discovered = discovery.discover(discoveryConfig.getMaxProxies(),
                    discoveryConfig.isVerify());
            log.info("Adding {} discovered backend(s)", discovered.size());
            backends.addAll(discovered);
        }
        return backends;
    }

    private static IdentityPool identityPool(RotationProperties props, RotationConfig config) {
        List<String> configured = props.getIdentities();
        List<String> identities = configured == null || configured.isEmpty() ? DefaultIdentities.USER_AGENTS
                : configured;
        return new IdentityPool(identities, config.getStrategy(), config.isRotateIdentity(),
                props.getFixedIdentity());
    }
}
