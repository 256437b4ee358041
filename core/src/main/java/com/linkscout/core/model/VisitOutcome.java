package com.linkscout.core.model;

import java.util.List;
import java.util.Objects;

/**
 * 방문 결과(일회성). 상태 리포터와 자식 enqueue 단계에서 즉시 소비된다.
 * children 은 도달 가능 + 스코프 내 + 깊이 제한 이내인 경우에만 채워진다.
 */
public record VisitOutcome(String url, Integer statusCode, List<CrawlTarget> children) {

    /** 도달 불가 시 상태 코드 자리에 찍히는 표식(숫자가 아님) */
    public static final String UNREACHABLE = "ERR";

    public VisitOutcome {
        Objects.requireNonNull(url, "url");
        children = (children == null) ? List.of() : List.copyOf(children);
    }

    public static VisitOutcome reached(String url, int statusCode, List<CrawlTarget> children) {
        return new VisitOutcome(url, statusCode, children);
    }

    public static VisitOutcome unreachable(String url) {
        return new VisitOutcome(url, null, List.of());
    }

    public boolean isReachable() { return statusCode != null; }

    /** 리포터 필터가 검사하는 문자열 형태 */
    public String statusLabel() {
        return isReachable() ? String.valueOf(statusCode) : UNREACHABLE;
    }
}
