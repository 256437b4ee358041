package com.linkscout.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 원시 링크 문자열 → 정규화된 절대 URL. 네트워크 접근 없음.
 * <ul>
 *   <li>{@code #...}(프래그먼트 전용), {@code javascript:}, {@code vbscript:}, {@code data:} 는 버린다</li>
 *   <li>authority 가 없으면 페이지 URL 기준 상대 해석(RFC 3986)</li>
 *   <li>authority 가 있으면 그대로 사용(정규 문자열로 재직렬화)</li>
 *   <li>잘못된 URL 은 예외 없이 버린다</li>
 * </ul>
 * 정규 문자열: fragment 제거, scheme/host 소문자. 경로·쿼리는 건드리지 않는다
 * (끝 슬래시/쿼리 변형은 서로 다른 URL).
 */
public final class LinkNormalizer {
    private static final Logger LOG = LoggerFactory.getLogger(LinkNormalizer.class);

    private static final List<String> DROPPED_SCHEMES = List.of("javascript:", "vbscript:", "data:");

    private LinkNormalizer() {}

    public static Optional<String> normalize(String raw, String base) {
        if (raw == null) return Optional.empty();
        String link = raw.trim();
        if (link.startsWith("#")) return Optional.empty();
        if (isNonNavigable(link)) return Optional.empty();

        try {
            URI ref = new URI(escapeSpaces(link));

            // mailto:, tel: 등 opaque → 자기 자신(스킴만 소문자). exclude 패턴이 볼 수 있도록 유지
            if (ref.isOpaque()) {
                return Optional.of(ref.getScheme().toLowerCase(Locale.ROOT) + ":" + ref.getRawSchemeSpecificPart());
            }

            URI abs;
            if (ref.getRawAuthority() != null) {
                // //host/x (스킴 상대) → base 스킴 사용
                abs = (ref.getScheme() != null) ? ref : new URI(schemeOf(base) + ":" + ref.toString());
            } else {
                if (base == null) return Optional.empty();
                abs = resolve(new URI(escapeSpaces(base.trim())), ref, link);
            }
            return Optional.ofNullable(canonical(abs));
        } catch (URISyntaxException | IllegalArgumentException e) {
            LOG.debug("Dropping malformed link '{}' (base={}): {}", raw, base, e.getMessage());
            return Optional.empty();
        }
    }

    /** 스크립트 실행/인라인 데이터 스킴. 방문할 대상이 없다 */
    private static boolean isNonNavigable(String link) {
        String lower = link.toLowerCase(Locale.ROOT);
        for (String scheme : DROPPED_SCHEMES) {
            if (lower.startsWith(scheme)) return true;
        }
        return false;
    }

    /** 시드처럼 이미 절대 URL 인 입력 */
    public static Optional<String> normalize(String absoluteUrl) {
        return normalize(absoluteUrl, absoluteUrl);
    }

    private static URI resolve(URI base, URI ref, String link) throws URISyntaxException {
        String basePath = base.getRawPath();
        if (basePath == null || basePath.isEmpty()) {
            // URI.resolve 는 경로 없는 base 에 상대경로를 붙일 때 '/' 를 빼먹는다
            base = new URI(base.getScheme() + "://" + base.getRawAuthority() + "/"
                    + (base.getRawQuery() != null ? "?" + base.getRawQuery() : ""));
            basePath = "/";
        }
        if (link.startsWith("?")) {
            // RFC 3986: 쿼리 전용 참조는 base 경로를 유지
            return new URI(base.getScheme() + "://" + base.getRawAuthority() + basePath + link);
        }
        return base.resolve(ref);
    }

    private static String canonical(URI u) {
        String scheme = u.getScheme();
        String authority = u.getRawAuthority();
        if (scheme == null || authority == null) return null;

        StringBuilder sb = new StringBuilder(64)
                .append(scheme.toLowerCase(Locale.ROOT))
                .append("://")
                .append(lowerHost(authority));
        if (u.getRawPath() != null) sb.append(u.getRawPath());
        if (u.getRawQuery() != null) sb.append('?').append(u.getRawQuery());
        return sb.toString();
    }

    /** userinfo 는 보존하고 host(:port) 부분만 소문자 */
    private static String lowerHost(String authority) {
        int at = authority.lastIndexOf('@');
        if (at < 0) return authority.toLowerCase(Locale.ROOT);
        return authority.substring(0, at + 1) + authority.substring(at + 1).toLowerCase(Locale.ROOT);
    }

    private static String schemeOf(String base) {
        if (base != null) {
            int i = base.indexOf(':');
            if (i > 0) return base.substring(0, i).toLowerCase(Locale.ROOT);
        }
        return "http";
    }

    // href 안의 공백은 흔하다. 나머지 불법 문자는 URISyntaxException 으로 버린다
    private static String escapeSpaces(String s) {
        return s.indexOf(' ') >= 0 ? s.replace(" ", "%20") : s;
    }
}
