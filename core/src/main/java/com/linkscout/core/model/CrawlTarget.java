package com.linkscout.core.model;

import java.net.URI;
import java.util.Objects;

/**
 * 방문 대상 한 건. 시드(depth 0)이거나 링크 추출로 생성되며 생성 후 불변.
 *
 * @param url     정규화된 절대 URL 문자열(방문 장부의 키)
 * @param depth   재귀 깊이(0 이상)
 * @param baseUrl 이 대상이 유래한 시드의 scheme+authority
 */
public record CrawlTarget(String url, int depth, String baseUrl) {

    public CrawlTarget {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(baseUrl, "baseUrl");
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
    }

    public static CrawlTarget seed(String url, String baseUrl) {
        return new CrawlTarget(url, 0, baseUrl);
    }

    /** 같은 시드 아래 한 단계 깊은 자식 */
    public CrawlTarget child(String childUrl) {
        return new CrawlTarget(childUrl, depth + 1, baseUrl);
    }

    public URI uri() {
        return URI.create(url);
    }
}
