package com.kawari.proxy.core.discovery;

import com.kawari.proxy.config.DiscoveryConfig;
import com.kawari.proxy.core.constants.BackendScheme;
import com.kawari.proxy.core.constants.HeaderConstants;
import com.kawari.proxy.core.rotation.BackendDescriptor;
import com.kawari.proxy.spi.BackendDiscovery;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Discovers HTTP proxy backends from public plain-text lists ({@code host:port} per line).
 * Sources are fetched concurrently; candidates can optionally be probed before use.
 */
public class PublicListDiscovery implements BackendDiscovery {
    private static final Logger log = LoggerFactory.getLogger(PublicListDiscovery.class);

    private static final int MAX_HOST_LENGTH = 253;

    private final List<String> sources;
    private final Duration fetchTimeout;
    private final URI verifyUrl;
    private final Duration verifyTimeout;
    private final String userAgent;
    private final HttpClient fetchClient;

    public PublicListDiscovery(DiscoveryConfig config) {
        this.sources = config.getSources() != null ? List.copyOf(config.getSources())
                : DiscoveryConfig.DEFAULT_SOURCES;
        this.fetchTimeout = Duration.ofMillis(config.getFetchTimeout());
        this.verifyUrl = URI.create(config.getVerifyUrl());
        this.verifyTimeout = Duration.ofMillis(config.getVerifyTimeout());
        this.userAgent = config.getUserAgent();
        this.fetchClient = HttpClient.newBuilder()
                .connectTimeout(fetchTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public List<BackendDescriptor> discover(int limit, boolean verify) throws InterruptedException {
        Map<String, CompletableFuture<HttpResponse<String>>> pending = new LinkedHashMap<>();
        for (String source : sources) {
            pending.put(source, fetch(source));
        }

        Set<BackendDescriptor> unique = new LinkedHashSet<>();
        for (Map.Entry<String, CompletableFuture<HttpResponse<String>>> entry : pending.entrySet()) {
            if (limit > 0 && unique.size() >= limit) {
                entry.getValue().cancel(true);
                continue;
            }
            List<BackendDescriptor> parsed = await(entry.getKey(), entry.getValue());
            for (BackendDescriptor candidate : parsed) {
                if (limit > 0 && unique.size() >= limit) {
                    log.info("Reached discovery limit of {}", limit);
                    break;
                }
                unique.add(candidate);
            }
        }
        log.info("Discovered {} unique backend(s) from {} source(s)", unique.size(), sources.size());

        List<BackendDescriptor> candidates = new ArrayList<>(unique);
        return verify ? verifyAll(candidates) : candidates;
    }

    private CompletableFuture<HttpResponse<String>> fetch(String source) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(source))
                    .timeout(fetchTimeout)
                    .header(HeaderConstants.USER_AGENT.getValue(), userAgent)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        log.info("Fetching backends from {}", source);
        return fetchClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
    }

    private List<BackendDescriptor> await(String source, CompletableFuture<HttpResponse<String>> future)
            throws InterruptedException {
        try {
            HttpResponse<String> response = future.get();
            if (response.statusCode() / 100 != 2) {
                log.warn("Failed to fetch backends from {}: HTTP {}", source, response.statusCode());
                return List.of();
            }
            List<BackendDescriptor> parsed = parse(response.body());
            log.info("Fetched {} backend(s) from {}", parsed.size(), source);
            return parsed;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Failed to fetch backends from {}: {}", source, cause.toString());
            return List.of();
        }
    }

    /**
     * Probes every candidate concurrently through itself; keeps those answering 200, in order.
     */
    private List<BackendDescriptor> verifyAll(List<BackendDescriptor> candidates) throws InterruptedException {
        log.info("Verifying {} backend(s) against {}", candidates.size(), verifyUrl);
        List<CompletableFuture<Boolean>> probes = new ArrayList<>(candidates.size());
        for (BackendDescriptor candidate : candidates) {
            probes.add(probe(candidate));
        }
        List<BackendDescriptor> working = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            try {
                if (Boolean.TRUE.equals(probes.get(i).get())) {
                    working.add(candidates.get(i));
                }
            } catch (ExecutionException e) {
                log.debug("Probe of {} failed: {}", candidates.get(i), e.getCause());
            }
        }
        log.info("Found {} working backend(s)", working.size());
        return working;
    }

    private CompletableFuture<Boolean> probe(BackendDescriptor candidate) {
        HttpClient client = HttpClient.newBuilder()
                .proxy(ProxySelector.of(InetSocketAddress.createUnresolved(candidate.host(), candidate.port())))
                .connectTimeout(verifyTimeout)
                .build();
        HttpRequest request = HttpRequest.newBuilder(verifyUrl)
                .timeout(verifyTimeout)
                .header(HeaderConstants.USER_AGENT.getValue(), userAgent)
                .GET()
                .build();
        return client.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .thenApply(r -> r.statusCode() == 200)
                .exceptionally(t -> {
                    log.debug("Backend {} failed verification: {}", candidate, t.toString());
                    return false;
                });
    }

    /**
     * Parses a list body. Blank and {@code #} lines are skipped, as are entries with an
     * invalid host or port.
     *
     * @param body list contents.
     * @return backends in order of appearance, duplicates included.
     */
    static List<BackendDescriptor> parse(String body) {
        List<BackendDescriptor> result = new ArrayList<>();
        if (body == null) {
            return result;
        }
        for (String raw : body.split("\n")) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String[] parts = line.split(":");
            if (parts.length < 2) {
                continue;
            }
            String host = parts[0].trim();
            int port;
            try {
                port = Integer.parseInt(parts[1].trim());
            } catch (NumberFormatException e) {
                continue;
            }
            if (isValidHost(host) && port >= 1 && port <= 65535) {
                result.add(new BackendDescriptor(host, port, BackendScheme.HTTP));
            }
        }
        return result;
    }

    /**
     * A dotted quad with octets in range, or a name made of letters, digits, dots and dashes.
     *
     * @param host candidate host.
     * @return whether it is usable.
     */
    static boolean isValidHost(String host) {
        if (host == null || host.isEmpty() || host.length() > MAX_HOST_LENGTH) {
            return false;
        }
        String[] octets = host.split("\\.", -1);
        if (octets.length == 4) {
            try {
                for (String octet : octets) {
                    int value = Integer.parseInt(octet);
                    if (value < 0 || value > 255) {
                        return false;
                    }
                }
                return true;
            } catch (NumberFormatException e) {
                // not numeric, fall through to the host name check
            }
        }
        for (int i = 0; i < host.length(); i++) {
            char c = host.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '.' && c != '-') {
                return false;
            }
        }
        return true;
    }
}
