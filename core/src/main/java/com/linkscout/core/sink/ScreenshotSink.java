package com.linkscout.core.sink;

import com.linkscout.core.api.PageSink;
import com.linkscout.core.api.RenderedPage;
import com.linkscout.core.model.CrawlTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/** {@code --screenshot=<dir>}: 페이지마다 {@code <dir>/<정리된 URL>.png} */
public final class ScreenshotSink implements PageSink {
    private static final Logger LOG = LoggerFactory.getLogger(ScreenshotSink.class);
    private static final int MAX_NAME = 200;

    private final Path dir;
    private final AtomicBoolean warnedUnsupported = new AtomicBoolean(false);

    public ScreenshotSink(Path dir) {
        this.dir = Objects.requireNonNull(dir, "dir");
    }

    @Override
    public void accept(CrawlTarget target, RenderedPage page) throws IOException {
        if (!page.supportsScreenshot()) {
            if (warnedUnsupported.compareAndSet(false, true)) {
                LOG.warn("Screenshots are not available with the static renderer; skipping");
            }
            return;
        }
        Files.createDirectories(dir);
        page.screenshot(dir.resolve(fileNameFor(target.url())));
    }

    /** {@code https://a.test/x?y=1} → {@code a.test_x_y_1.png} */
    static String fileNameFor(String url) {
        String s = url.replaceFirst("^[A-Za-z][A-Za-z0-9+.-]*://", "");
        s = s.replaceAll("[^A-Za-z0-9.-]+", "_");
        s = s.replaceAll("^_+|_+$", "");
        if (s.isEmpty()) s = "page";
        if (s.length() > MAX_NAME) s = s.substring(0, MAX_NAME);
        return s + ".png";
    }

    @Override public String name() { return "screenshot"; }
}
