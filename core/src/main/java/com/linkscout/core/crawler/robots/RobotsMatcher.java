package com.linkscout.core.crawler.robots;

import java.net.URI;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 경로 기준 규칙 매칭.
 * <ul>
 *   <li>대상은 raw path (쿼리 무시, 디코딩 없음), 퍼센트 HEX 는 대문자로 통일</li>
 *   <li>{@code *} 임의 길이, 끝의 {@code $} 는 경로 끝 고정</li>
 *   <li>평문 규칙은 세그먼트 경계까지의 접두 매칭, '/' 로 끝나면 하위 전부</li>
 *   <li>여러 규칙이 맞으면 더 구체적인(긴) 규칙이 이기고, 같으면 Allow</li>
 * </ul>
 */
public final class RobotsMatcher {
    private RobotsMatcher() {}

    public static boolean isAllowed(URI url, RobotsRules rules) {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(rules, "rules");

        String path = normalizePath(url);
        Verdict best = null;
        for (String rule : rules.disallow()) {
            if (matches(path, rule)) best = stronger(best, new Verdict(false, rule));
        }
        for (String rule : rules.allow()) {
            if (matches(path, rule)) best = stronger(best, new Verdict(true, rule));
        }
        return best == null || best.allow();
    }

    /** 규칙 값 정규화: trim + 퍼센트 HEX 대문자. 끝 '$' 보존 */
    static String normalizeRule(String rule) {
        if (rule == null) return "";
        String r = rule.trim();
        if (r.isEmpty()) return r;
        boolean anchored = r.endsWith("$");
        if (anchored) r = r.substring(0, r.length() - 1);
        r = uppercasePctHex(r);
        return anchored ? r + "$" : r;
    }

    static Verdict stronger(Verdict a, Verdict b) {
        if (a == null) return b;
        int la = specificity(a.rule()), lb = specificity(b.rule());
        if (lb != la) return lb > la ? b : a;
        return (b.allow() && !a.allow()) ? b : a;
    }

    static boolean matches(String path, String rule) {
        if (rule == null || rule.isBlank()) return false;
        String r = rule.trim();
        boolean anchored = r.endsWith("$");
        if (anchored) r = r.substring(0, r.length() - 1);

        if (r.indexOf('*') >= 0) {
            String regex = "^" + wildcardToRegex(r) + (anchored ? "$" : ".*");
            return Pattern.compile(regex).matcher(path).matches();
        }
        if (anchored) return path.equals(r);
        if (r.endsWith("/")) return path.startsWith(r);
        if (!path.startsWith(r)) return false;
        return path.length() == r.length() || path.charAt(r.length()) == '/';
    }

    private static String wildcardToRegex(String s) {
        StringBuilder sb = new StringBuilder();
        int start = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == '*') {
                if (i > start) sb.append(Pattern.quote(s.substring(start, i)));
                sb.append(".*");
                start = i + 1;
            }
        }
        if (start < s.length()) sb.append(Pattern.quote(s.substring(start)));
        return sb.toString();
    }

    static String normalizePath(URI uri) {
        String rawPath = uri.getRawPath();
        if (rawPath == null || rawPath.isEmpty()) rawPath = "/";
        return uppercasePctHex(rawPath);
    }

    static String uppercasePctHex(String s) {
        StringBuilder out = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (ch == '%' && i + 2 < s.length() && isHex(s.charAt(i + 1)) && isHex(s.charAt(i + 2))) {
                out.append('%')
                   .append(Character.toUpperCase(s.charAt(i + 1)))
                   .append(Character.toUpperCase(s.charAt(i + 2)));
                i += 2;
                continue;
            }
            out.append(ch);
        }
        return out.toString();
    }

    private static boolean isHex(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    /** 구체성: 끝 '$' 와 '*' 를 뺀 글자 수 */
    static int specificity(String rule) {
        if (rule == null) return 0;
        String r = rule.trim();
        int end = r.endsWith("$") ? r.length() - 1 : r.length();
        int score = 0;
        for (int i = 0; i < end; i++) {
            if (r.charAt(i) != '*') score++;
        }
        return score;
    }

    record Verdict(boolean allow, String rule) {}
}
