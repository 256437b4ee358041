package com.linkscout.core.util;

/**
 * 전역 요청 간격 제한기(크롤 예의). 초당 rps 회를 넘지 않도록 다음 슬롯까지 대기한다.
 * rps <= 0 이면 대기 없음.
 */
public final class RateLimiter {
    private final long intervalNs;
    private long nextSlotNs;

    public RateLimiter(int rps) {
        this.intervalNs = (rps > 0) ? 1_000_000_000L / rps : 0L;
        this.nextSlotNs = System.nanoTime();
    }

    public static RateLimiter unlimited() { return new RateLimiter(0); }

    public boolean isUnlimited() { return intervalNs == 0L; }

    public void acquire() throws InterruptedException {
        if (intervalNs == 0L) return;
        long waitNs;
        synchronized (this) {
            long now = System.nanoTime();
            long slot = Math.max(now, nextSlotNs);
            nextSlotNs = slot + intervalNs;
            waitNs = slot - now;
        }
        if (waitNs > 0) {
            Thread.sleep(waitNs / 1_000_000L, (int) (waitNs % 1_000_000L));
        }
    }
}
