package com.booking.sync.web.server;

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Server orchestrators by session id. An entry expires after it has not been read or written for the configured
 * duration.
 */
public class WebServerSessionCache {

    public interface Configuration {
        String EXPIRATION_SECONDS = "webserver.session.expiration.seconds";
    }

    public static final long DEFAULT_EXPIRATION_SECONDS = 3600L;

    private final Cache<String, WebServerOrchestrator> cache;

    public WebServerSessionCache(Map<String, Object> configuration) {
        this(
                Duration.ofSeconds(Long.parseLong(configuration.getOrDefault(Configuration.EXPIRATION_SECONDS, WebServerSessionCache.DEFAULT_EXPIRATION_SECONDS).toString())),
                Ticker.systemTicker()
        );
    }

    public WebServerSessionCache(Duration expiration, Ticker ticker) {
        this.cache = CacheBuilder.newBuilder()
                .expireAfterAccess(expiration.toMillis(), TimeUnit.MILLISECONDS)
                .ticker(ticker)
                .build();
    }

    public Optional<WebServerOrchestrator> get(String sessionId) {
        return Optional.ofNullable(this.cache.getIfPresent(sessionId));
    }

    public void put(String sessionId, WebServerOrchestrator orchestrator) {
        this.cache.put(sessionId, orchestrator);
    }

    public void invalidate(String sessionId) {
        this.cache.invalidate(sessionId);
    }

    public long size() {
        this.cache.cleanUp();

        return this.cache.size();
    }
}
