package com.linkscout.core.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BasicAuthTest {

    @Test
    void parsesUserAndPassword() {
        BasicAuth a = BasicAuth.parse("alice:s3cr:et");
        assertThat(a.user()).isEqualTo("alice");
        assertThat(a.password()).isEqualTo("s3cr:et");
        // "alice:s3cr:et" base64
        assertThat(a.headerValue()).isEqualTo("Basic YWxpY2U6czNjcjpldA==");
    }

    @Test
    void blankMeansNoAuth() {
        assertThat(BasicAuth.parse(null)).isNull();
        assertThat(BasicAuth.parse("  ")).isNull();
    }

    @Test
    void missingColonIsRejected() {
        assertThatThrownBy(() -> BasicAuth.parse("alice")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toStringHidesPassword() {
        assertThat(BasicAuth.parse("alice:secret").toString()).doesNotContain("secret");
    }
}
