package com.linkscout.core.crawler;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 실행 1회 동안의 방문 장부. 여러 시드가 같은 장부를 공유한다.
 * 키는 정규화된 URL 문자열 그대로(추가 정규화 없음).
 */
public final class VisitedLedger {
    private final Set<String> visited = ConcurrentHashMap.newKeySet();

    /**
     * 처음 보는 URL 이면 방문 처리하고 true. 확인과 기록은 하나의 원자적 연산이다.
     */
    public boolean shouldVisit(String url) {
        return url != null && visited.add(url);
    }

    public boolean contains(String url) {
        return url != null && visited.contains(url);
    }

    public int size() {
        return visited.size();
    }
}
