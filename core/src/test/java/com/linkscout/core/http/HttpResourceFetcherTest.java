package com.linkscout.core.http;

import com.linkscout.core.model.FetchResult;
import com.linkscout.core.testutil.TestSite;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpResourceFetcherTest {

    private TestSite site;
    private HttpResourceFetcher fetcher;

    @BeforeEach
    void setUp() throws Exception {
        site = new TestSite().bytes("/logo.png", "image/png", new byte[]{9, 8, 7});
        fetcher = new HttpResourceFetcher(HttpResourceFetcher.newClient(Duration.ofSeconds(5)),
                "LinkScout-Test/1.0", Duration.ofSeconds(5), null);
    }

    @AfterEach
    void tearDown() {
        site.close();
    }

    @Test
    void statusOnlyDiscardsBody() throws Exception {
        FetchResult r = fetcher.fetch(URI.create(site.url("/logo.png")), false);
        assertThat(r.statusCode()).isEqualTo(200);
        assertThat(r.isSuccess()).isTrue();
        assertThat(r.contentType()).isEqualTo("image/png");
        assertThat(r.body()).isNull();
    }

    @Test
    void withBodyKeepsBytes() throws Exception {
        FetchResult r = fetcher.fetch(URI.create(site.url("/logo.png")), true);
        assertThat(r.body()).containsExactly(9, 8, 7);
    }

    @Test
    void missingImageIsAStatusNotAnError() throws Exception {
        FetchResult r = fetcher.fetch(URI.create(site.url("/gone.png")), true);
        assertThat(r.statusCode()).isEqualTo(404);
        assertThat(r.isSuccess()).isFalse();
    }

    @Test
    void followsRedirects() throws Exception {
        site.redirect("/old.png", 301, "/logo.png");
        FetchResult r = fetcher.fetch(URI.create(site.url("/old.png")), false);
        assertThat(r.statusCode()).isEqualTo(200);
    }

    @Test
    void connectionFailureIsIOException() {
        String dead = site.url("/logo.png");
        site.close();
        assertThatThrownBy(() -> fetcher.fetch(URI.create(dead), false)).isInstanceOf(IOException.class);
    }

    @Test
    void slowResponseTimesOut() {
        site.slow("/slow.png", 2_000, "late");
        HttpResourceFetcher quick = new HttpResourceFetcher(HttpResourceFetcher.newClient(Duration.ofMillis(200)),
                "LinkScout-Test/1.0", Duration.ofMillis(200), null);

        assertThatThrownBy(() -> quick.fetch(URI.create(site.url("/slow.png")), false)).isInstanceOf(IOException.class);
    }
}
