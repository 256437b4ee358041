package com.linkscout.core.crawler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class VisitedLedgerTest {

    @Test
    void firstCallWinsAndMarks() {
        VisitedLedger ledger = new VisitedLedger();
        assertThat(ledger.shouldVisit("http://a.test/x")).isTrue();
        assertThat(ledger.shouldVisit("http://a.test/x")).isFalse();
        assertThat(ledger.contains("http://a.test/x")).isTrue();
        assertThat(ledger.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("추가 정규화 없음: 끝 슬래시 변형은 다른 항목")
    void exactStringIdentity() {
        VisitedLedger ledger = new VisitedLedger();
        assertThat(ledger.shouldVisit("http://a.test/x")).isTrue();
        assertThat(ledger.shouldVisit("http://a.test/x/")).isTrue();
        assertThat(ledger.shouldVisit("http://a.test/x?")).isTrue();
        assertThat(ledger.shouldVisit(null)).isFalse();
    }

    @Test
    @DisplayName("동시에 같은 URL 을 물어도 true 는 정확히 한 번")
    void atomicUnderContention() throws Exception {
        VisitedLedger ledger = new VisitedLedger();
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Callable<Integer>> tasks = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                tasks.add(() -> {
                    start.await();
                    int wins = 0;
                    for (int i = 0; i < 500; i++) {
                        if (ledger.shouldVisit("http://a.test/" + i)) wins++;
                    }
                    return wins;
                });
            }
            List<Future<Integer>> futures = new ArrayList<>();
            for (Callable<Integer> c : tasks) futures.add(pool.submit(c));
            start.countDown();
            int total = 0;
            for (Future<Integer> f : futures) total += f.get();
            assertThat(total).isEqualTo(500);
        } finally {
            pool.shutdownNow();
        }
        assertThat(ledger.size()).isEqualTo(500);
    }
}
