package com.linkscout.core.crawler;

import com.linkscout.core.model.ScopeConfig;

/**
 * URL 이 재귀 대상(in-scope)인지 판정. 순수 함수, I/O 없음, 같은 입력이면 같은 결과.
 * <p>
 * 패턴 매칭은 "search" 가 아니라 "match" 의미다: 전체 URL 문자열(스킴 포함)의 시작에 고정된
 * 접두 매칭({@link java.util.regex.Matcher#lookingAt()}).
 */
public final class ScopeClassifier {
    private ScopeClassifier() {}

    /**
     * include 가 있으면 include 매칭만으로, 없으면 시드 base URL 접두(www. 무시)로 판정.
     * exclude 에 걸리면 include/도메인 판정과 무관하게 false.
     */
    public static boolean isInScope(String url, ScopeConfig scope) {
        if (url == null || scope == null) return false;
        if (isExcluded(url, scope)) return false;
        if (scope.include() != null) {
            return scope.include().matcher(url).lookingAt();
        }
        return stripWww(url).startsWith(stripWww(scope.baseUrl()));
    }

    /** exclude 패턴 단독 판정 */
    public static boolean isExcluded(String url, ScopeConfig scope) {
        return url != null && scope != null && scope.exclude() != null
                && scope.exclude().matcher(url).lookingAt();
    }

    /** {@code scheme://www.host} → {@code scheme://host} (첫 번째만) */
    static String stripWww(String url) {
        int i = url.indexOf("://");
        if (i < 0) return url;
        int hostStart = i + 3;
        if (url.regionMatches(true, hostStart, "www.", 0, 4)) {
            return url.substring(0, hostStart) + url.substring(hostStart + 4);
        }
        return url;
    }
}
