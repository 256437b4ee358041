package com.linkscout.core.crawler.robots;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 호스트(host:port)별 robots 정책 캐시. 호스트마다 최초 조회 시 한 번만 fetch 하며,
 * 같은 호스트를 동시에 조회하는 워커는 그 fetch 가 끝날 때까지 기다린다.
 * 어떤 실패든 allow-all 로 떨어진다.
 */
public final class RobotsRepository {
    private static final Logger LOG = LoggerFactory.getLogger(RobotsRepository.class);

    public static final Duration DEFAULT_SUCCESS_TTL = Duration.ofMinutes(30);
    public static final Duration DEFAULT_FAILURE_TTL = Duration.ofMinutes(10);
    private static final int MAX_REDIRECTS = 3;

    private final RobotsFetcher fetcher;
    private final RobotsClock clock;
    private final String userAgent;
    private final Duration successTtl;
    private final Duration failureTtl;
    private final Map<String, CacheEntry> cache = new ConcurrentHashMap<>();
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    public RobotsRepository(RobotsFetcher fetcher, RobotsClock clock, String userAgent) {
        this(fetcher, clock, userAgent, DEFAULT_SUCCESS_TTL, DEFAULT_FAILURE_TTL);
    }

    public RobotsRepository(RobotsFetcher fetcher, RobotsClock clock, String userAgent,
                            Duration successTtl, Duration failureTtl) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.userAgent = userAgent;
        this.successTtl = (successTtl == null ? DEFAULT_SUCCESS_TTL : successTtl);
        this.failureTtl = (failureTtl == null ? DEFAULT_FAILURE_TTL : failureTtl);
    }

    /** host:port (포트 없으면 스킴 기본 포트) */
    static String cacheKey(URI pageUri) {
        String scheme = Optional.ofNullable(pageUri.getScheme()).orElse("https").toLowerCase(Locale.ROOT);
        String host = Optional.ofNullable(pageUri.getHost()).orElse("").toLowerCase(Locale.ROOT);
        int port = pageUri.getPort();
        if (port < 0) port = scheme.equals("http") ? 80 : 443;
        return host + ":" + port;
    }

    public RobotsPolicy policyFor(URI pageUri) {
        String key = cacheKey(pageUri);
        CacheEntry hit = fresh(key);
        if (hit != null) return hit.policy();

        synchronized (locks.computeIfAbsent(key, k -> new Object())) {
            hit = fresh(key);
            if (hit != null) return hit.policy();

            RobotsPolicy policy = fetchPolicy(pageUri);
            long ttlMs = policy.isAllowAll() ? failureTtl.toMillis() : successTtl.toMillis();
            cache.put(key, new CacheEntry(policy, clock.nowMillis() + ttlMs));
            return policy;
        }
    }

    /** 캐시된 호스트 수(테스트/리포트용) */
    public int cachedHosts() {
        return cache.size();
    }

    private CacheEntry fresh(String key) {
        CacheEntry e = cache.get(key);
        return (e != null && e.expiresAt() > clock.nowMillis()) ? e : null;
    }

    private RobotsPolicy fetchPolicy(URI pageUri) {
        String scheme = Optional.ofNullable(pageUri.getScheme()).orElse("").toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) return RobotsPolicy.allowAll();

        URI cur = robotsTxtUri(pageUri);
        if (cur == null) return RobotsPolicy.allowAll();

        for (int i = 0; i <= MAX_REDIRECTS; i++) {
            RobotsFetcher.Response r = fetcher.fetch(cur);
            int s = r.status();
            if (r.isNetworkError()) {
                LOG.debug("robots.txt unavailable at {} ({}), allowing all", cur, r.error().orElse("?"));
                return RobotsPolicy.allowAll();
            }
            if (s >= 200 && s < 300) {
                LOG.debug("robots.txt loaded from {}", cur);
                return RobotsPolicy.parse(r.body(), userAgent);
            }
            if (isRedirect(s) && r.finalUri() != null && sameHost(cur, r.finalUri())) {
                cur = r.finalUri();
                continue;
            }
            LOG.debug("robots.txt at {} answered {}, allowing all", cur, s);
            return RobotsPolicy.allowAll();
        }
        LOG.debug("robots.txt redirect limit exceeded for {}, allowing all", pageUri.getHost());
        return RobotsPolicy.allowAll();
    }

    private static boolean isRedirect(int s) {
        return s == 301 || s == 302 || s == 307 || s == 308;
    }

    private static boolean sameHost(URI a, URI b) {
        String ha = Optional.ofNullable(a.getHost()).orElse("").toLowerCase(Locale.ROOT);
        String hb = Optional.ofNullable(b.getHost()).orElse("").toLowerCase(Locale.ROOT);
        return ha.equals(hb);
    }

    static URI robotsTxtUri(URI page) {
        String host = page.getHost();
        if (host == null || host.isEmpty()) return null;
        String scheme = Optional.ofNullable(page.getScheme()).orElse("https").toLowerCase(Locale.ROOT);
        int port = page.getPort();
        String authority = (port < 0) ? host : host + ":" + port;
        return URI.create(scheme + "://" + authority + "/robots.txt");
    }

    private record CacheEntry(RobotsPolicy policy, long expiresAt) {}
}
