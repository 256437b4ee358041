package com.linkscout.core.crawler.robots;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** 한 User-agent 그룹의 Allow/Disallow 값(정규화 후) */
public final class RobotsRules {
    private final List<String> allow = new ArrayList<>();
    private final List<String> disallow = new ArrayList<>();

    public RobotsRules addAllow(String path) {
        if (path != null && !path.isBlank()) allow.add(path.trim());
        return this;
    }

    /** 빈 Disallow 는 "전부 허용" 이므로 규칙으로 남기지 않는다 */
    public RobotsRules addDisallow(String path) {
        if (path != null && !path.isBlank()) disallow.add(path.trim());
        return this;
    }

    public List<String> allow() { return Collections.unmodifiableList(allow); }
    public List<String> disallow() { return Collections.unmodifiableList(disallow); }

    public boolean isEmpty() { return allow.isEmpty() && disallow.isEmpty(); }
}
