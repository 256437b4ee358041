package com.linkscout.core.crawler.robots;

import java.net.URI;
import java.util.Objects;

/**
 * 방문 직전 robots 허용 여부. ignore 모드면 항상 허용하고 robots.txt 를 조회하지 않는다.
 */
public final class RobotsGate {
    private final RobotsRepository repository;
    private final boolean ignore;

    public RobotsGate(RobotsRepository repository, boolean ignore) {
        this.repository = ignore ? repository : Objects.requireNonNull(repository, "repository");
        this.ignore = ignore;
    }

    public static RobotsGate ignoring() {
        return new RobotsGate(null, true);
    }

    public boolean allowed(URI url) {
        if (ignore) return true;
        return repository.policyFor(url).allow(url);
    }

    public boolean isIgnoring() {
        return ignore;
    }
}
