package com.linkscout.core.render;

import com.linkscout.core.api.IPageRenderer;
import com.linkscout.core.api.RenderException;
import com.linkscout.core.api.RenderedPage;
import com.linkscout.core.model.CrawlConfig;
import com.linkscout.core.util.BasicAuth;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.options.WaitUntilState;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * headless Chromium 렌더러(기본). 스크립트를 실행한 뒤의 DOM 에서 링크를 뽑는다.
 * <p>
 * Playwright 객체는 스레드 안전하지 않으므로 워커 스레드마다 브라우저 세션을 하나씩 둔다.
 * 세션은 {@link #close()} 에서 한꺼번에 정리하며, 그 시점에는 워커가 모두 끝나 있어야 한다.
 */
public class PlaywrightPageRenderer implements IPageRenderer {
    private static final Logger LOG = LoggerFactory.getLogger(PlaywrightPageRenderer.class);

    private final CrawlConfig config;
    private final BasicAuth auth;
    private final ThreadLocal<Session> local = new ThreadLocal<>();
    private final Queue<Session> opened = new ConcurrentLinkedQueue<>();

    public PlaywrightPageRenderer(CrawlConfig config) {
        this.config = config;
        this.auth = BasicAuth.parse(config.getHttpBasic());
    }

    @Override
    public RenderedPage render(URI url) throws RenderException {
        BrowserContext context = session().context;
        Page page = null;
        try {
            page = context.newPage();
            Response res = page.navigate(url.toString(), new Page.NavigateOptions()
                    .setTimeout((double) config.getTimeoutMs())
                    .setWaitUntil(WaitUntilState.LOAD));
            if (res == null) {
                throw new RenderException(url + ": navigation produced no response");
            }
            long waitMs = config.getWaitBeforeExtract().toMillis();
            if (waitMs > 0) page.waitForTimeout(waitMs);

            String location = page.url();
            Document doc = Jsoup.parse(page.content(), location);
            return new BrowserPage(page, res.status(), location,
                    DomExtraction.links(doc), DomExtraction.images(doc), doc.outerHtml());
        } catch (PlaywrightException e) {
            closeQuietly(page);
            throw new RenderException(url + ": " + firstLine(e.getMessage()), e);
        } catch (RenderException e) {
            closeQuietly(page);
            throw e;
        }
    }

    @Override
    public void close() {
        Session s;
        while ((s = opened.poll()) != null) {
            try {
                s.playwright.close();
            } catch (PlaywrightException e) {
                LOG.warn("Browser shutdown failed: {}", firstLine(e.getMessage()));
            }
        }
    }

    /** 지금까지 연 브라우저 세션 수 */
    int sessionCount() {
        return opened.size();
    }

    private Session session() {
        Session s = local.get();
        if (s == null) {
            try {
                s = Session.open(config, auth);
            } catch (PlaywrightException e) {
                throw new IllegalStateException("Could not start headless Chromium: " + firstLine(e.getMessage()), e);
            }
            local.set(s);
            opened.add(s);
            LOG.debug("Browser session started on {}", Thread.currentThread().getName());
        }
        return s;
    }

    private static void closeQuietly(Page page) {
        if (page == null) return;
        try {
            page.close();
        } catch (PlaywrightException e) {
            LOG.debug("Page close failed: {}", firstLine(e.getMessage()));
        }
    }

    private static String firstLine(String msg) {
        if (msg == null) return "";
        int nl = msg.indexOf('\n');
        return nl < 0 ? msg : msg.substring(0, nl);
    }

    private static final class Session {
        final Playwright playwright;
        final Browser browser;
        final BrowserContext context;

        private Session(Playwright playwright, Browser browser, BrowserContext context) {
            this.playwright = playwright;
            this.browser = browser;
            this.context = context;
        }

        static Session open(CrawlConfig config, BasicAuth auth) {
            Playwright pw = Playwright.create();
            try {
                Browser browser = pw.chromium().launch(new BrowserType.LaunchOptions().setHeadless(true));
                Browser.NewContextOptions opts = new Browser.NewContextOptions()
                        .setViewportSize(config.getWidth(), config.getHeight())
                        .setUserAgent(config.getUserAgent());
                if (auth != null) opts.setHttpCredentials(auth.user(), auth.password());
                return new Session(pw, browser, browser.newContext(opts));
            } catch (PlaywrightException e) {
                pw.close();
                throw e;
            }
        }
    }

    /** 방문 처리 동안 열려 있는 브라우저 탭 */
    private static final class BrowserPage implements RenderedPage {
        private final Page page;
        private final int status;
        private final String location;
        private final List<String> links;
        private final List<String> images;
        private final String body;

        BrowserPage(Page page, int status, String location, List<String> links, List<String> images, String body) {
            this.page = page;
            this.status = status;
            this.location = location;
            this.links = List.copyOf(links);
            this.images = List.copyOf(images);
            this.body = body;
        }

        @Override public int statusCode() { return status; }
        @Override public String location() { return location; }
        @Override public List<String> links() { return links; }
        @Override public List<String> images() { return images; }
        @Override public String body() { return body; }
        @Override public boolean supportsScreenshot() { return true; }

        @Override
        public void screenshot(Path file) throws IOException {
            try {
                page.screenshot(new Page.ScreenshotOptions().setPath(file).setFullPage(true));
            } catch (PlaywrightException e) {
                throw new IOException("screenshot failed: " + firstLine(e.getMessage()), e);
            }
        }

        @Override
        public void close() {
            closeQuietly(page);
        }
    }
}
