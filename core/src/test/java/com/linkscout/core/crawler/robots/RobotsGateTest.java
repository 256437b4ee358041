package com.linkscout.core.crawler.robots;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class RobotsGateTest {

    @Test
    void consultsPolicy() {
        URI robots = URI.create("http://site.test/robots.txt");
        FakeFetcher f = new FakeFetcher().stub(robots, 200, "User-agent: *\nDisallow: /private\n");
        RobotsGate gate = new RobotsGate(new RobotsRepository(f, new FrozenClock(0), "LinkScout/1.0"), false);

        assertThat(gate.allowed(URI.create("http://site.test/private"))).isFalse();
        assertThat(gate.allowed(URI.create("http://site.test/public"))).isTrue();
    }

    @Test
    void ignoringGateNeverFetches() {
        RobotsGate gate = RobotsGate.ignoring();
        assertThat(gate.isIgnoring()).isTrue();
        assertThat(gate.allowed(URI.create("http://site.test/private"))).isTrue();
    }
}
