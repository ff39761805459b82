package com.kawari.proxy.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Settings for pulling backends from public proxy lists.
 */
public class DiscoveryConfig {
    /** Default public lists, one {@code host:port} per line. */
    public static final List<String> DEFAULT_SOURCES = List.of(
            "https://api.proxyscrape.com/v2/?request=get&protocol=http&timeout=10000&country=all&ssl=all&anonymity=all",
            "https://www.proxy-list.download/api/v1/get?type=http",
            "https://raw.githubusercontent.com/TheSpeedX/PROXY-List/master/http.txt",
            "https://raw.githubusercontent.com/ShiftyTR/Proxy-List/master/http.txt",
            "https://raw.githubusercontent.com/monosans/proxy-list/main/proxies/http.txt",
            "https://raw.githubusercontent.com/clarketm/proxy-list/master/proxy-list-raw.txt");

    private boolean enabled = false;

    /** Cap on discovered backends. 0 means no cap. */
    private int maxProxies = 50;

    /** Probe every candidate before registering it. */
    private boolean verify = false;

    private List<String> sources = new ArrayList<>(DEFAULT_SOURCES);

    /** Per-source fetch timeout in milliseconds. */
    private long fetchTimeout = 10000;

    private String verifyUrl = "http://httpbin.org/ip";

    /** Per-candidate probe timeout in milliseconds. */
    private long verifyTimeout = 5000;

    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxProxies() {
        return maxProxies;
    }

    public void setMaxProxies(int maxProxies) {
        this.maxProxies = maxProxies;
    }

    public boolean isVerify() {
        return verify;
    }

    public void setVerify(boolean verify) {
        this.verify = verify;
    }

    public List<String> getSources() {
        return sources == null ? null : Collections.unmodifiableList(sources);
    }

    public void setSources(List<String> sources) {
        this.sources = sources == null ? null : new ArrayList<>(sources);
    }

    public long getFetchTimeout() {
        return fetchTimeout;
    }

    public void setFetchTimeout(long fetchTimeout) {
        this.fetchTimeout = fetchTimeout;
    }

    public String getVerifyUrl() {
        return verifyUrl;
    }

    public void setVerifyUrl(String verifyUrl) {
        this.verifyUrl = verifyUrl;
    }

    public long getVerifyTimeout() {
        return verifyTimeout;
    }

    public void setVerifyTimeout(long verifyTimeout) {
        this.verifyTimeout = verifyTimeout;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }
}
