package com.linkscout.core.crawler;

import com.linkscout.core.api.ICrawler;
import com.linkscout.core.api.IPageRenderer;
import com.linkscout.core.api.IResourceFetcher;
import com.linkscout.core.api.PageSink;
import com.linkscout.core.api.RenderException;
import com.linkscout.core.api.RenderedPage;
import com.linkscout.core.crawler.robots.RobotsGate;
import com.linkscout.core.model.CrawlConfig;
import com.linkscout.core.model.CrawlStats;
import com.linkscout.core.model.CrawlTarget;
import com.linkscout.core.model.FetchResult;
import com.linkscout.core.model.ScopeConfig;
import com.linkscout.core.model.VisitOutcome;
import com.linkscout.core.sink.ImageStore;
import com.linkscout.core.util.LinkNormalizer;
import com.linkscout.core.util.NamedThreadFactory;
import com.linkscout.core.util.RateLimiter;
import com.linkscout.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * 재귀 링크 순회 엔진.
 * <ul>
 *   <li>시드마다 스코프/robots 를 새로 만들고, 방문 장부는 실행 전체에서 공유</li>
 *   <li>장부 확인은 발견 시점(큐에 넣기 전), robots 확인은 방문 시점</li>
 *   <li>exclude 에 걸린 링크는 발견 단계에서 버린다(렌더·보고 없음). 시드는 예외</li>
 *   <li>도달한 페이지는 스코프와 무관하게 보고 + 부수효과, 링크 추출은 스코프 안 + 깊이 제한 이내만</li>
 *   <li>렌더 실패는 ERR 로 한 번 보고하고 그 가지만 끝낸다. 재시도 없음</li>
 * </ul>
 * 워커 수는 {@link CrawlConfig#getConcurrency()} 고정 풀로 제한한다.
 */
public class Crawler implements ICrawler {

    private static final Logger LOG = LoggerFactory.getLogger(Crawler.class);
    private static final StructuredLog SLOG = StructuredLog.get(Crawler.class);
    private static final long POLL_MS = 50L;

    private final CrawlConfig config;
    private final IPageRenderer renderer;
    private final IResourceFetcher resources;       // 이미지 모드가 아니면 null
    private final Supplier<RobotsGate> robotsGates; // 시드마다 새 게이트
    private final StatusReporter reporter;
    private final List<PageSink> sinks;
    private final ImageStore imageStore;            // 저장 모드가 아니면 null
    private final VisitedLedger ledger;
    private final RateLimiter rateLimiter;

    private final CrawlStats stats = new CrawlStats();
    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private volatile boolean workersTerminated = true;

    public Crawler(CrawlConfig config,
                   IPageRenderer renderer,
                   IResourceFetcher resources,
                   Supplier<RobotsGate> robotsGates,
                   StatusReporter reporter,
                   List<PageSink> sinks,
                   ImageStore imageStore) {
        this(config, renderer, resources, robotsGates, reporter, sinks, imageStore, new VisitedLedger());
    }

    public Crawler(CrawlConfig config,
                   IPageRenderer renderer,
                   IResourceFetcher resources,
                   Supplier<RobotsGate> robotsGates,
                   StatusReporter reporter,
                   List<PageSink> sinks,
                   ImageStore imageStore,
                   VisitedLedger ledger) {
        this.config = Objects.requireNonNull(config, "config");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.robotsGates = Objects.requireNonNull(robotsGates, "robotsGates");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.sinks = (sinks == null) ? List.of() : List.copyOf(sinks);
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.resources = resources;
        this.imageStore = imageStore;
        if (config.isImageHandlingEnabled() && resources == null) {
            throw new IllegalArgumentException("image handling requires a resource fetcher");
        }
        this.rateLimiter = new RateLimiter(config.getRps());
    }

    @Override
    public CrawlStats.Snapshot crawl(List<String> seeds) throws InterruptedException {
        final int cc = Math.max(1, config.getConcurrency());
        SLOG.info("crawl-start", "seeds", seeds.size(), "maxDepth", config.getMaxDepth(),
                "cc", cc, "rps", config.getRps(), "ignoreRobots", config.isIgnoreRobots());

        ExecutorService exec = Executors.newFixedThreadPool(cc, new NamedThreadFactory("crawl-worker"));
        try {
            for (String seed : seeds) {
                if (stopping.get()) break;
                crawlSeed(seed, exec, cc);
            }
        } finally {
            exec.shutdownNow();
            // 진행 중인 요청은 각자 timeout 안에 끝난다
            long graceMs = config.getTimeoutMs() + POLL_MS;
            workersTerminated = exec.awaitTermination(graceMs, TimeUnit.MILLISECONDS);
            if (!workersTerminated) {
                LOG.warn("Crawl workers still running {} ms after shutdown", graceMs);
            }
        }

        CrawlStats.Snapshot snap = stats.snapshot();
        LOG.info("Crawl done. visited={}, unreachable={}, robotsSkipped={}, excluded={}, maxObservedCC={}",
                snap.visited(), snap.unreachable(), snap.robotsSkipped(), snap.excluded(),
                snap.maxObservedConcurrency());
        SLOG.info("crawl-done", "visited", snap.visited(), "unreachable", snap.unreachable(),
                "robotsSkipped", snap.robotsSkipped(), "excluded", snap.excluded(),
                "imagesChecked", snap.imagesChecked(), "maxObservedCC", snap.maxObservedConcurrency());
        return snap;
    }

    @Override
    public void stop() {
        if (stopping.compareAndSet(false, true)) {
            LOG.info("Stop requested; no new pages will be scheduled");
        }
    }

    /** 마지막 crawl 의 워커가 모두 끝났는지. false 면 렌더러를 닫으면 안 된다 */
    public boolean workersTerminated() {
        return workersTerminated;
    }

    public VisitedLedger ledger() {
        return ledger;
    }

    private void crawlSeed(String rawSeed, ExecutorService exec, int workers) throws InterruptedException {
        Optional<String> normalized = LinkNormalizer.normalize(rawSeed);
        if (normalized.isEmpty()) {
            LOG.warn("Skipping malformed seed {}", rawSeed);
            return;
        }
        String seed = normalized.get();
        if (!ledger.shouldVisit(seed)) {
            LOG.info("Seed {} was already visited in this run", seed);
            return;
        }
        ScopeConfig scope = ScopeConfig.forSeed(seed, config);
        CrawlSession session = new CrawlSession(scope, robotsGates.get());
        session.push(CrawlTarget.seed(seed, scope.baseUrl()));
        SLOG.info("seed-start", "seed", seed, "base", scope.baseUrl());

        // 끝나는 순서대로 확인해야 한 워커의 치명적 실패가 다른 워커의 긴 렌더 뒤에 묻히지 않는다
        CompletionService<Void> done = new ExecutorCompletionService<>(exec);
        for (int i = 0; i < workers; i++) {
            done.submit(() -> workLoop(session), null);
        }
        for (int i = 0; i < workers; i++) {
            try {
                done.take().get();
            } catch (ExecutionException e) {
                throw new IllegalStateException("crawl worker failed", e.getCause());
            }
        }
    }

    private void workLoop(CrawlSession session) {
        while (!stopping.get()) {
            CrawlTarget target;
            try {
                target = session.poll(POLL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            }
            if (target == null) {
                if (session.isDrained()) return;
                continue;
            }
            try {
                visit(session, target);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            } catch (IllegalStateException e) {
                // 렌더러 자체를 못 띄운 경우: 이후 URL 도 모두 실패하므로 크롤 중단
                stop();
                throw e;
            } catch (RuntimeException e) {
                // 렌더 이후 단계의 예기치 못한 실패. 보고와 자식 enqueue 는 이미 끝났다
                LOG.error("Unexpected failure while processing {}", target.url(), e);
            } finally {
                session.done();
            }
        }
    }

    private void visit(CrawlSession session, CrawlTarget target) throws InterruptedException {
        URI uri = target.uri();
        if (!session.robots().allowed(uri)) {
            stats.addRobotsSkipped();
            LOG.debug("robots.txt disallows {}", target.url());
            return;
        }

        rateLimiter.acquire();
        stats.observeConcurrency(inFlight.incrementAndGet());
        try {
            RenderedPage rendered = renderOrReport(target, uri);
            if (rendered == null) return;
            try (RenderedPage page = rendered) {
                stats.addVisited();

                ScopeConfig scope = session.scope();
                boolean recurse = ScopeClassifier.isInScope(target.url(), scope)
                        && scope.allowsExtractionAt(target.depth());
                List<CrawlTarget> children = recurse ? discover(session, target, page) : List.of();

                reporter.report(VisitOutcome.reached(target.url(), page.statusCode(), children));
                // 장부에 이미 표시된 자식이므로 부수효과보다 먼저 넣는다
                session.pushChildren(children);

                runSinks(target, page);
                if (config.isImageHandlingEnabled()) checkImages(session, page);
            }
        } finally {
            inFlight.decrementAndGet();
        }
    }

    /**
     * 렌더 실패는 종류와 무관하게 ERR 한 번. 렌더러 기동 실패({@link IllegalStateException})만 위로 보낸다.
     * @return 실패면 null
     */
    private RenderedPage renderOrReport(CrawlTarget target, URI uri) {
        try {
            return renderer.render(uri);
        } catch (RenderException e) {
            LOG.debug("Unreachable {}: {}", target.url(), e.getMessage());
        } catch (IllegalStateException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.warn("Renderer failed on {}: {}", target.url(), e.toString());
        }
        stats.addUnreachable();
        reporter.report(VisitOutcome.unreachable(target.url()));
        return null;
    }

    /** 자식 링크: 정규화 → exclude → 장부. 문서 순서 유지 */
    private List<CrawlTarget> discover(CrawlSession session, CrawlTarget parent, RenderedPage page) {
        List<CrawlTarget> out = new ArrayList<>();
        for (String raw : page.links()) {
            Optional<String> n = LinkNormalizer.normalize(raw, page.location());
            if (n.isEmpty()) continue;
            String url = n.get();
            if (ScopeClassifier.isExcluded(url, session.scope())) {
                stats.addExcluded();
                continue;
            }
            if (ledger.shouldVisit(url)) out.add(parent.child(url));
        }
        return out;
    }

    private void runSinks(CrawlTarget target, RenderedPage page) {
        for (PageSink sink : sinks) {
            try {
                sink.accept(target, page);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            } catch (Exception e) {
                LOG.warn("{} failed for {}: {}", sink.name(), target.url(), e.toString());
            }
        }
    }

    private void checkImages(CrawlSession session, RenderedPage page) throws InterruptedException {
        final boolean save = (imageStore != null);
        for (String raw : page.images()) {
            Optional<String> n = LinkNormalizer.normalize(raw, page.location());
            if (n.isEmpty() || !isHttp(n.get())) continue; // data: 등 인라인 이미지
            String url = n.get();
            if (ScopeClassifier.isExcluded(url, session.scope())) {
                stats.addExcluded();
                continue;
            }
            if (!ledger.shouldVisit(url)) continue;

            URI uri = URI.create(url);
            if (!session.robots().allowed(uri)) {
                stats.addRobotsSkipped();
                continue;
            }

            rateLimiter.acquire();
            FetchResult res;
            try {
                res = resources.fetch(uri, save);
            } catch (IOException e) {
                stats.addUnreachable();
                LOG.debug("Image unreachable {}: {}", url, e.toString());
                reporter.report(VisitOutcome.unreachable(url));
                continue;
            }
            stats.addImageChecked();
            reporter.report(VisitOutcome.reached(url, res.statusCode(), List.of()));

            if (save && res.isSuccess()) {
                try {
                    imageStore.save(url, res.body());
                    stats.addImageSaved();
                } catch (IOException e) {
                    LOG.warn("Could not save image {}: {}", url, e.toString());
                }
            }
        }
    }

    private static boolean isHttp(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }
}
