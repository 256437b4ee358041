package com.linkscout.core.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlConfigTest {

    private static CrawlConfig valid() {
        return CrawlConfig.defaults().addSeed("https://site.test");
    }

    @Test
    void defaults() {
        CrawlConfig c = CrawlConfig.defaults();
        assertThat(c.getMaxDepth()).isNull();
        assertThat(c.hasDepthLimit()).isFalse();
        assertThat(c.getPrintStatus()).isEqualTo(".*");
        assertThat(c.getConcurrency()).isEqualTo(1);
        assertThat(c.getRenderer()).isEqualTo(CrawlConfig.RendererKind.BROWSER);
        assertThat(c.isImageHandlingEnabled()).isFalse();
        assertThat(c.getUserAgent()).isEqualTo(CrawlConfig.DEFAULT_USER_AGENT);
    }

    @Test
    void validConfigPasses() {
        assertThatCode(() -> valid().setMaxDepth(0).setInclude("^https://site").validate()).doesNotThrowAnyException();
    }

    @Test
    void requiresHttpSeed() {
        assertThatThrownBy(() -> CrawlConfig.defaults().validate()).hasMessageContaining("seed");
        assertThatThrownBy(() -> CrawlConfig.defaults().addSeed("site.test").validate())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsBadValues() {
        assertThatThrownBy(() -> valid().setMaxDepth(-1).validate()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> valid().setConcurrency(0).validate()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> valid().setRps(-1).validate()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> valid().setHttpBasic("nocolon").validate()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> valid().setTimeout(Duration.ZERO).validate()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> valid().setWidth(0).validate()).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void invalidRegexIsAConfigError() {
        assertThatThrownBy(() -> valid().setInclude("(unclosed").validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("include");
        assertThatThrownBy(() -> valid().setPrintStatus("[").validate())
                .hasMessageContaining("print-status");
    }

    @Test
    void blankStringsMeanUnset() {
        CrawlConfig c = valid().setInclude(" ").setExclude("").setExecute("  ");
        assertThat(c.getInclude()).isNull();
        assertThat(c.getExclude()).isNull();
        assertThat(c.getExecute()).isNull();
    }

    @Test
    void imageHandlingFollowsEitherFlag() {
        assertThat(valid().setCheckImages(true).isImageHandlingEnabled()).isTrue();
        assertThat(valid().setSaveImagesDir(Path.of("imgs")).isImageHandlingEnabled()).isTrue();
    }

    @Test
    void forSeedScopeUsesSchemeAndAuthority() {
        ScopeConfig s = ScopeConfig.forSeed("https://site.test:8443/docs/index.html", valid().setMaxDepth(3));
        assertThat(s.baseUrl()).isEqualTo("https://site.test:8443");
        assertThat(s.allowsExtractionAt(2)).isTrue();
        assertThat(s.allowsExtractionAt(3)).isFalse();
    }
}
