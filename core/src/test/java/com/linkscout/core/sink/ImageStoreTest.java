package com.linkscout.core.sink;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ImageStoreTest {

    @Test
    void namesFilesAfterLastPathSegment() {
        assertThat(ImageStore.fileNameOf("http://a.test/img/logo.png")).isEqualTo("logo.png");
        assertThat(ImageStore.fileNameOf("http://a.test/img/logo.png?v=2")).isEqualTo("logo.png");
        assertThat(ImageStore.fileNameOf("http://a.test/img/my%20pic.jpg")).isEqualTo("my_pic.jpg");
        assertThat(ImageStore.fileNameOf("http://a.test/")).isEqualTo("image");
        assertThat(ImageStore.fileNameOf("http://a.test")).isEqualTo("image");
    }

    @Test
    void collidingNamesGetSuffix(@TempDir Path tmp) throws Exception {
        ImageStore store = new ImageStore(tmp.resolve("imgs"));

        Path first = store.save("http://a.test/x/logo.png", new byte[]{1});
        Path second = store.save("http://b.test/y/logo.png", new byte[]{2});
        Path third = store.save("http://c.test/logo.png", new byte[]{3});

        assertThat(first.getFileName()).hasToString("logo.png");
        assertThat(second.getFileName()).hasToString("logo-1.png");
        assertThat(third.getFileName()).hasToString("logo-2.png");
        assertThat(Files.readAllBytes(second)).containsExactly(2);
    }

    @Test
    void doesNotOverwriteFilesFromEarlierRuns(@TempDir Path tmp) throws Exception {
        Files.write(tmp.resolve("logo.png"), new byte[]{0});

        Path saved = new ImageStore(tmp).save("http://a.test/logo.png", new byte[]{7});

        assertThat(saved.getFileName()).hasToString("logo-1.png");
        assertThat(Files.readAllBytes(tmp.resolve("logo.png"))).containsExactly(0);
    }
}
