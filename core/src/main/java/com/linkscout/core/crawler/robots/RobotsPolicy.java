package com.linkscout.core.crawler.robots;

import java.net.URI;
import java.util.Objects;

/** 한 호스트에 대해 선택된 UA 그룹 규칙. 생성 후 불변, 조회만 한다. */
public final class RobotsPolicy {

    private static final RobotsPolicy ALLOW_ALL = new RobotsPolicy(new RobotsRules(), true);

    private final RobotsRules rules;
    private final boolean allowAll;

    private RobotsPolicy(RobotsRules rules, boolean allowAll) {
        this.rules = Objects.requireNonNull(rules);
        this.allowAll = allowAll;
    }

    public static RobotsPolicy parse(String robotsTxt, String userAgent) {
        RobotsRules picked = RobotsParser.parse(robotsTxt).selectFor(userAgent);
        return new RobotsPolicy(picked, false);
    }

    /** robots.txt 없음/실패 시 */
    public static RobotsPolicy allowAll() {
        return ALLOW_ALL;
    }

    public boolean allow(URI url) {
        if (allowAll) return true;
        return RobotsMatcher.isAllowed(url, rules);
    }

    public boolean isAllowAll() {
        return allowAll;
    }
}
