package com.linkscout.core.crawler.robots;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RobotsRepositoryTest {

    private static final String UA = "LinkScout/1.0";

    @Test
    @DisplayName("성공 응답은 30분 캐시: 만료 전에는 다시 받지 않는다")
    void successCachedUntilTtl() {
        URI page = URI.create("https://ex.com/path");
        URI robots = URI.create("https://ex.com/robots.txt");
        FakeFetcher f = new FakeFetcher().stub(robots, 200, "User-agent: *\nDisallow: /private\n");
        FrozenClock clk = new FrozenClock(0);
        RobotsRepository repo = new RobotsRepository(f, clk, UA);

        assertFalse(repo.policyFor(page).allow(URI.create("https://ex.com/private")));
        clk.plusMillis(Duration.ofMinutes(29).toMillis());
        assertFalse(repo.policyFor(page).allow(URI.create("https://ex.com/private")));
        assertThat(f.calls(robots)).isEqualTo(1);

        clk.plusMillis(Duration.ofMinutes(2).toMillis());
        repo.policyFor(page);
        assertThat(f.calls(robots)).isEqualTo(2);
    }

    @Test
    @DisplayName("404 → allow-all, 10분 캐시")
    void notFoundAllowsAll() {
        URI page = URI.create("https://ex.com/x");
        URI robots = URI.create("https://ex.com/robots.txt");
        FakeFetcher f = new FakeFetcher().stub(robots, 404, "");
        FrozenClock clk = new FrozenClock(0);
        RobotsRepository repo = new RobotsRepository(f, clk, UA);

        RobotsPolicy p = repo.policyFor(page);
        assertTrue(p.isAllowAll());
        assertTrue(p.allow(URI.create("https://ex.com/any")));

        clk.plusMillis(Duration.ofMinutes(9).plusSeconds(59).toMillis());
        repo.policyFor(page);
        assertThat(f.calls(robots)).isEqualTo(1);

        clk.plusMillis(Duration.ofSeconds(2).toMillis());
        repo.policyFor(page);
        assertThat(f.calls(robots)).isEqualTo(2);
    }

    @Test
    @DisplayName("네트워크 오류 → allow-all")
    void networkErrorAllowsAll() {
        URI robots = URI.create("https://down.test/robots.txt");
        RobotsRepository repo = new RobotsRepository(new FakeFetcher().fail(robots, "refused"), new FrozenClock(0), UA);
        assertTrue(repo.policyFor(URI.create("https://down.test/a")).allow(URI.create("https://down.test/a")));
    }

    @Test
    void sameHostRedirectIsFollowed() {
        URI robotsHttp = URI.create("http://ex.com/robots.txt");
        URI robotsHttps = URI.create("https://ex.com/robots.txt");
        FakeFetcher f = new FakeFetcher()
                .redirect(robotsHttp, robotsHttps, 301)
                .stub(robotsHttps, 200, "User-agent: *\nDisallow: /q\n");
        RobotsRepository repo = new RobotsRepository(f, new FrozenClock(0), UA);

        assertFalse(repo.policyFor(URI.create("http://ex.com/x")).allow(URI.create("http://ex.com/q?a=1")));
    }

    @Test
    void crossHostRedirectAllowsAll() {
        URI robotsA = URI.create("https://a.com/robots.txt");
        URI robotsB = URI.create("https://b.com/robots.txt");
        FakeFetcher f = new FakeFetcher()
                .redirect(robotsA, robotsB, 302)
                .stub(robotsB, 200, "User-agent: *\nDisallow: /\n");
        RobotsRepository repo = new RobotsRepository(f, new FrozenClock(0), UA);

        assertTrue(repo.policyFor(URI.create("https://a.com/x")).allow(URI.create("https://a.com/anything")));
        assertThat(f.calls(robotsB)).isZero();
    }

    @Test
    void hostsAreCachedSeparatelyByPort() {
        assertThat(RobotsRepository.cacheKey(URI.create("http://ex.com/a")))
                .isEqualTo("ex.com:80");
        assertThat(RobotsRepository.cacheKey(URI.create("https://EX.com/a")))
                .isEqualTo("ex.com:443");
        assertThat(RobotsRepository.cacheKey(URI.create("http://ex.com:8080/a")))
                .isEqualTo("ex.com:8080");
        assertThat(RobotsRepository.robotsTxtUri(URI.create("http://ex.com:8080/a/b?c")))
                .hasToString("http://ex.com:8080/robots.txt");
    }

    @Test
    @DisplayName("같은 호스트를 동시에 조회해도 robots.txt 는 한 번만 받는다")
    void concurrentLookupsFetchOnce() throws Exception {
        URI robots = URI.create("https://busy.test/robots.txt");
        FakeFetcher f = new FakeFetcher().stub(robots, 200, "User-agent: *\nDisallow: /x\n").delay(100);
        RobotsRepository repo = new RobotsRepository(f, new FrozenClock(0), UA);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                URI page = URI.create("https://busy.test/p" + i);
                tasks.add(() -> repo.policyFor(page).allow(page));
            }
            for (Future<Boolean> fut : pool.invokeAll(tasks)) {
                assertTrue(fut.get());
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(f.calls(robots)).isEqualTo(1);
        assertThat(repo.cachedHosts()).isEqualTo(1);
    }
}
