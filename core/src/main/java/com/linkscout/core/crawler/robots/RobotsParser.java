package com.linkscout.core.crawler.robots;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * robots.txt 파서.
 * - 지원 지시어: User-agent / Allow / Disallow (키 대소문자 무시), 나머지는 무시
 * - 연속된 User-agent 라인은 같은 그룹, 그 뒤 Allow/Disallow 누적
 * - 그룹 선택: 제품 토큰 일치(대소문자 무시) → 없으면 "*"
 */
public final class RobotsParser {
    private RobotsParser() {}

    private static final Pattern KV = Pattern.compile("^\\s*([A-Za-z-]+)\\s*:\\s*(.*?)\\s*$");
    static final String UA_ALL = "*";

    public static ParsedRobots parse(String robotsTxt) {
        if (robotsTxt == null) robotsTxt = "";

        Map<String, RobotsRules> byUa = new LinkedHashMap<>();
        List<String> currentAgents = new ArrayList<>();
        boolean lastWasUa = false;

        for (String rawLine : robotsTxt.split("\\r?\\n")) {
            String line = stripComment(rawLine).trim();
            if (line.isEmpty()) continue;

            Matcher m = KV.matcher(line);
            if (!m.matches()) continue;

            String key = m.group(1).toLowerCase(Locale.ROOT);
            String val = m.group(2).trim();

            switch (key) {
                case "user-agent" -> {
                    String ua = (val.isEmpty() ? UA_ALL : val).toLowerCase(Locale.ROOT);
                    if (!lastWasUa) currentAgents = new ArrayList<>();
                    currentAgents.add(ua);
                    byUa.putIfAbsent(ua, new RobotsRules());
                    lastWasUa = true;
                }
                case "allow", "disallow" -> {
                    if (currentAgents.isEmpty()) {
                        currentAgents.add(UA_ALL);
                        byUa.putIfAbsent(UA_ALL, new RobotsRules());
                    }
                    if (!val.isEmpty()) {
                        String norm = RobotsMatcher.normalizeRule(val);
                        for (String ua : currentAgents) {
                            if (key.equals("allow")) byUa.get(ua).addAllow(norm);
                            else byUa.get(ua).addDisallow(norm);
                        }
                    }
                    lastWasUa = false;
                }
                default -> lastWasUa = false;
            }
        }
        byUa.putIfAbsent(UA_ALL, new RobotsRules());
        return new ParsedRobots(byUa);
    }

    /** "LinkScout/1.0 (+http://..)" → "linkscout" */
    static String productToken(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) return UA_ALL;
        String s = userAgent.trim();
        int cut = s.length();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '/' || c == ' ' || c == '(') { cut = i; break; }
        }
        return s.substring(0, cut).toLowerCase(Locale.ROOT);
    }

    private static String stripComment(String s) {
        int i = s.indexOf('#');
        return i >= 0 ? s.substring(0, i) : s;
    }

    public record ParsedRobots(Map<String, RobotsRules> byUa) {

        public RobotsRules selectFor(String userAgent) {
            String token = productToken(userAgent);
            RobotsRules exact = byUa.get(token);
            if (exact != null) return exact;
            RobotsRules star = byUa.get(UA_ALL);
            return (star != null ? star : new RobotsRules());
        }
    }
}
