package com.linkscout.core.service;

import com.linkscout.core.api.IPageRenderer;
import com.linkscout.core.api.IResourceFetcher;
import com.linkscout.core.api.PageSink;
import com.linkscout.core.crawler.Crawler;
import com.linkscout.core.crawler.StatusReporter;
import com.linkscout.core.crawler.robots.HttpRobotsFetcher;
import com.linkscout.core.crawler.robots.RobotsClock;
import com.linkscout.core.crawler.robots.RobotsFetcher;
import com.linkscout.core.crawler.robots.RobotsGate;
import com.linkscout.core.crawler.robots.RobotsRepository;
import com.linkscout.core.http.HttpResourceFetcher;
import com.linkscout.core.model.CrawlConfig;
import com.linkscout.core.model.CrawlStats;
import com.linkscout.core.render.JsoupPageRenderer;
import com.linkscout.core.render.PlaywrightPageRenderer;
import com.linkscout.core.report.CrawlReport;
import com.linkscout.core.report.JsonCrawlReportWriter;
import com.linkscout.core.sink.ExecuteSink;
import com.linkscout.core.sink.ImageStore;
import com.linkscout.core.sink.ScreenshotSink;
import com.linkscout.core.util.BasicAuth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * 크롤 오케스트레이터: 설정 → 렌더러/fetcher/싱크/리포터 조립 → 크롤 → (옵션) JSON 리포트.
 * DI 생성자는 테스트용.
 */
public final class CrawlService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlService.class);

    private final CrawlConfig config;
    private final IPageRenderer renderer;
    private final Crawler crawler;

    /** 기본 구현: 설정의 렌더러 종류에 따라 Playwright 또는 jsoup */
    public CrawlService(CrawlConfig config, PrintStream out) {
        this(config, out, defaultRenderer(config), defaultRobotsFetcher(config), RobotsClock.SYSTEM);
    }

    /** DI/테스트용 */
    public CrawlService(CrawlConfig config, PrintStream out, IPageRenderer renderer,
                        RobotsFetcher robotsFetcher, RobotsClock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        Objects.requireNonNull(out, "out");

        StatusReporter reporter = new StatusReporter(
                CrawlConfig.compile("print-status", config.getPrintStatus()), out);

        List<PageSink> sinks = new ArrayList<>();
        if (config.getScreenshotDir() != null) sinks.add(new ScreenshotSink(config.getScreenshotDir()));
        if (config.getExecute() != null) sinks.add(new ExecuteSink(config.getExecute(), config.getTimeout(), out));

        IResourceFetcher resources = config.isImageHandlingEnabled() ? new HttpResourceFetcher(config) : null;
        ImageStore images = (config.getSaveImagesDir() != null) ? new ImageStore(config.getSaveImagesDir()) : null;

        this.crawler = new Crawler(config, renderer, resources,
                robotsGates(config, robotsFetcher, clock), reporter, sinks, images);
    }

    public CrawlStats.Snapshot run() throws InterruptedException, IOException {
        Instant started = Instant.now();
        LOG.info("Crawl start: seeds={}, depth={}, renderer={}, cc={}",
                config.getSeeds(), config.hasDepthLimit() ? config.getMaxDepth() : "unbounded",
                config.getRenderer(), config.getConcurrency());

        CrawlStats.Snapshot snap = crawler.crawl(config.getSeeds());

        Path reportPath = config.getReportPath();
        if (reportPath != null) {
            new JsonCrawlReportWriter().write(CrawlReport.of(config, snap, started, Instant.now()), reportPath);
            LOG.info("Report written to {}", reportPath.toAbsolutePath());
        }
        return snap;
    }

    /** 새 방문 스케줄 중단. 진행 중인 방문은 끝까지 가고 {@link #run()} 은 정상 반환한다 */
    public void stop() {
        crawler.stop();
    }

    @Override
    public void close() {
        if (!crawler.workersTerminated()) {
            // 아직 렌더 중인 워커가 브라우저 세션을 쓰고 있다. 프로세스 종료에 맡긴다
            LOG.warn("Leaving renderer open: crawl workers did not terminate");
            return;
        }
        renderer.close();
    }

    private static IPageRenderer defaultRenderer(CrawlConfig config) {
        return (config.getRenderer() == CrawlConfig.RendererKind.STATIC)
                ? new JsoupPageRenderer(config)
                : new PlaywrightPageRenderer(config);
    }

    private static RobotsFetcher defaultRobotsFetcher(CrawlConfig config) {
        if (config.isIgnoreRobots()) return null;
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(config.getTimeout())
                .build(); // Redirect.NEVER: 리다이렉트는 RobotsRepository 가 직접 따라간다
        return new HttpRobotsFetcher(client, config.getUserAgent(), config.getTimeout(),
                BasicAuth.parse(config.getHttpBasic()));
    }

    private static Supplier<RobotsGate> robotsGates(CrawlConfig config, RobotsFetcher fetcher, RobotsClock clock) {
        if (config.isIgnoreRobots()) return RobotsGate::ignoring;
        Objects.requireNonNull(fetcher, "robotsFetcher");
        RobotsClock c = (clock != null) ? clock : RobotsClock.SYSTEM;
        // 시드마다 새 캐시
        return () -> new RobotsGate(new RobotsRepository(fetcher, c, config.getUserAgent()), false);
    }
}
