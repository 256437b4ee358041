package com.linkscout.core.crawler.robots;

import com.linkscout.core.testutil.TestSite;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class HttpRobotsFetcherTest {

    private TestSite site;
    private final HttpRobotsFetcher fetcher = new HttpRobotsFetcher(
            HttpClient.newHttpClient(), "LinkScout-Test/1.0", Duration.ofSeconds(5), null);

    @BeforeEach
    void setUp() throws Exception {
        site = new TestSite();
    }

    @AfterEach
    void tearDown() {
        site.close();
    }

    @Test
    void returnsBodyAndStatus() {
        site.text("/robots.txt", 200, "User-agent: *\nDisallow: /private\n");

        RobotsFetcher.Response r = fetcher.fetch(URI.create(site.url("/robots.txt")));

        assertThat(r.status()).isEqualTo(200);
        assertThat(r.body()).contains("Disallow: /private");
        assertThat(r.isNetworkError()).isFalse();
        assertThat(site.lastHeader("/robots.txt", "User-Agent")).isEqualTo("LinkScout-Test/1.0");
    }

    @Test
    void missingFileIs404() {
        RobotsFetcher.Response r = fetcher.fetch(URI.create(site.url("/robots.txt")));
        assertThat(r.status()).isEqualTo(404);
    }

    @Test
    void redirectIsHandedBackResolved() {
        site.redirect("/robots.txt", 301, "/elsewhere/robots.txt");

        RobotsFetcher.Response r = fetcher.fetch(URI.create(site.url("/robots.txt")));

        assertThat(r.status()).isEqualTo(301);
        assertThat(r.finalUri()).isEqualTo(URI.create(site.url("/elsewhere/robots.txt")));
    }

    @Test
    void deadHostIsNetworkError() {
        String dead = site.url("/robots.txt");
        site.close();

        RobotsFetcher.Response r = fetcher.fetch(URI.create(dead));

        assertThat(r.isNetworkError()).isTrue();
        assertThat(r.error()).isPresent();
    }

    @Test
    void slowResponseIsNetworkError() {
        site.slow("/robots.txt", 2_000, "User-agent: *\nDisallow: /\n");
        HttpRobotsFetcher quick = new HttpRobotsFetcher(
                HttpClient.newHttpClient(), "LinkScout-Test/1.0", Duration.ofMillis(200), null);

        RobotsFetcher.Response r = quick.fetch(URI.create(site.url("/robots.txt")));

        assertThat(r.isNetworkError()).isTrue();
    }
}
