package com.linkscout.core.model;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 시드 하나에 대한 스코프 설정. 시드마다 한 번 만들어지고 그 시드의 크롤 동안 불변.
 *
 * @param baseUrl  시드의 scheme+authority (예: {@code http://site.test})
 * @param include  있으면 도메인 기본 스코프를 완전히 대체
 * @param exclude  항상 적용, include 보다 우선
 * @param maxDepth null 이면 무제한
 */
public record ScopeConfig(String baseUrl, Pattern include, Pattern exclude, Integer maxDepth) {

    public ScopeConfig {
        Objects.requireNonNull(baseUrl, "baseUrl");
        if (maxDepth != null && maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
    }

    /** 정규화된 시드 URL + 전역 설정 → 시드 전용 스코프 */
    public static ScopeConfig forSeed(String seedUrl, CrawlConfig cfg) {
        return new ScopeConfig(
                baseUrlOf(seedUrl),
                CrawlConfig.compile("include", cfg.getInclude()),
                CrawlConfig.compile("exclude", cfg.getExclude()),
                cfg.getMaxDepth());
    }

    /** scheme + "://" + authority. authority 가 없으면 입력 그대로 */
    public static String baseUrlOf(String url) {
        URI u = URI.create(url);
        if (u.getScheme() == null || u.getRawAuthority() == null) return url;
        return u.getScheme().toLowerCase(Locale.ROOT) + "://" + u.getRawAuthority();
    }

    /** 이 깊이에서 링크 추출/재귀가 허용되는지 */
    public boolean allowsExtractionAt(int depth) {
        return maxDepth == null || depth < maxDepth;
    }
}
