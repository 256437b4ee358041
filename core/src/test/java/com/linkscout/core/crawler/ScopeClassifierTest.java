package com.linkscout.core.crawler;

import com.linkscout.core.model.ScopeConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class ScopeClassifierTest {

    private static ScopeConfig scope(String base, String include, String exclude) {
        return new ScopeConfig(base,
                include == null ? null : Pattern.compile(include),
                exclude == null ? null : Pattern.compile(exclude),
                null);
    }

    @Test
    @DisplayName("기본 스코프: 시드 base URL 접두")
    void domainDefault() {
        ScopeConfig s = scope("http://site.test", null, null);
        assertThat(ScopeClassifier.isInScope("http://site.test/a", s)).isTrue();
        assertThat(ScopeClassifier.isInScope("http://site.test", s)).isTrue();
        assertThat(ScopeClassifier.isInScope("http://external.test/b", s)).isFalse();
        assertThat(ScopeClassifier.isInScope("https://site.test/a", s)).isFalse();
    }

    @Test
    @DisplayName("www. 유무는 같은 사이트로 본다")
    void wwwIsEquivalent() {
        ScopeConfig plain = scope("http://example.com", null, null);
        ScopeConfig www = scope("http://www.example.com", null, null);
        assertThat(ScopeClassifier.isInScope("http://www.example.com/x", plain)).isTrue();
        assertThat(ScopeClassifier.isInScope("http://example.com/x", www)).isTrue();
    }

    @Test
    @DisplayName("include 가 있으면 도메인 기본값은 무시, 시작 고정 매칭")
    void includeOverridesDomain() {
        ScopeConfig s = scope("http://site.test", "http://other\\.test/docs", null);
        assertThat(ScopeClassifier.isInScope("http://other.test/docs/1", s)).isTrue();
        assertThat(ScopeClassifier.isInScope("http://site.test/a", s)).isFalse();
        // search 가 아니라 match: 중간에 있는 문자열은 인정하지 않는다
        assertThat(ScopeClassifier.isInScope("http://x.test/?r=http://other.test/docs", s)).isFalse();
    }

    @Test
    @DisplayName("exclude 는 include/도메인보다 우선")
    void excludeWins() {
        ScopeConfig s = scope("http://site.test", "http://site", "http://site\\.test/private");
        assertThat(ScopeClassifier.isInScope("http://site.test/private/x", s)).isFalse();
        assertThat(ScopeClassifier.isExcluded("http://site.test/private/x", s)).isTrue();
        assertThat(ScopeClassifier.isInScope("http://site.test/public", s)).isTrue();
    }

    @Test
    void excludeIsAnchoredToo() {
        ScopeConfig s = scope("http://site.test", null, "^mailto");
        assertThat(ScopeClassifier.isExcluded("mailto:a@b.com", s)).isTrue();
        assertThat(ScopeClassifier.isExcluded("http://site.test/mailto", s)).isFalse();
    }

    @Test
    @DisplayName("같은 입력이면 항상 같은 결과")
    void deterministic() {
        ScopeConfig s = scope("http://site.test", null, "http://site\\.test/x");
        for (int i = 0; i < 3; i++) {
            assertThat(ScopeClassifier.isInScope("http://site.test/a", s)).isTrue();
            assertThat(ScopeClassifier.isInScope("http://site.test/x", s)).isFalse();
        }
    }

    @Test
    void stripWwwOnlyTouchesHostStart() {
        assertThat(ScopeClassifier.stripWww("https://WWW.a.test/www.b")).isEqualTo("https://a.test/www.b");
        assertThat(ScopeClassifier.stripWww("mailto:www.a")).isEqualTo("mailto:www.a");
    }
}
