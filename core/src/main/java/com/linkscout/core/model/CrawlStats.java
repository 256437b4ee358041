package com.linkscout.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 크롤 런타임 카운터 (스레드 세이프). */
public final class CrawlStats {
    private final AtomicLong visited       = new AtomicLong(0); // 렌더 성공(상태코드 수신)
    private final AtomicLong unreachable   = new AtomicLong(0); // 렌더/fetch 실패
    private final AtomicLong robotsSkipped = new AtomicLong(0);
    private final AtomicLong excluded      = new AtomicLong(0); // exclude 패턴으로 발견 단계에서 버린 링크
    private final AtomicLong imagesChecked = new AtomicLong(0);
    private final AtomicLong imagesSaved   = new AtomicLong(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void addVisited()       { visited.incrementAndGet(); }
    public void addUnreachable()   { unreachable.incrementAndGet(); }
    public void addRobotsSkipped() { robotsSkipped.incrementAndGet(); }
    public void addExcluded()      { excluded.incrementAndGet(); }
    public void addImageChecked()  { imagesChecked.incrementAndGet(); }
    public void addImageSaved()    { imagesSaved.incrementAndGet(); }

    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        return new Snapshot(visited.get(), unreachable.get(), robotsSkipped.get(), excluded.get(),
                imagesChecked.get(), imagesSaved.get(), maxObservedConcurrency.get());
    }

    /** 불변 스냅샷 DTO */
    public record Snapshot(long visited,
                           long unreachable,
                           long robotsSkipped,
                           long excluded,
                           long imagesChecked,
                           long imagesSaved,
                           int maxObservedConcurrency) {}
}
