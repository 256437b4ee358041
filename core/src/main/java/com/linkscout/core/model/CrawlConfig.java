package com.linkscout.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 크롤 설정 (CLI 플래그 / crawl.yml 매핑 대상). 순수 설정 보관용.
 * 값 검증은 {@link #validate()} 한 곳에서만 수행하며, 실패는 크롤 시작 전에 치명적 오류로 취급한다.
 */
public final class CrawlConfig {

    /** 페이지 렌더러 종류 */
    public enum RendererKind {
        /** headless Chromium(Playwright): 스크립트 실행 + 스크린샷 */
        BROWSER,
        /** jsoup 정적 fetch: 스크립트 미실행 */
        STATIC
    }

    public static final String DEFAULT_USER_AGENT = "LinkScout/1.0";
    public static final String DEFAULT_PRINT_STATUS = ".*";

    // ---------- 시드/스코프 ----------
    private final List<String> seeds = new ArrayList<>();
    private Integer maxDepth;                 // null = 무제한
    private String include;                   // 있으면 도메인 기본 스코프를 완전히 대체
    private String exclude;                   // 항상 적용, include 보다 우선
    private String printStatus = DEFAULT_PRINT_STATUS;

    // ---------- 부수효과 ----------
    private boolean checkImages = false;
    private Path saveImagesDir;
    private Path screenshotDir;
    private int width = 1280;
    private int height = 800;
    private String execute;
    private Duration waitBeforeExtract = Duration.ZERO;

    // ---------- 네트워크/정책 ----------
    private String httpBasic;                 // "user:pass"
    private boolean ignoreRobots = false;
    private int concurrency = 1;              // 1 이면 원본과 같은 깊이 우선 순서
    private Duration timeout = Duration.ofSeconds(30);
    private int rps = 0;                      // 0 = 제한 없음
    private String userAgent = DEFAULT_USER_AGENT;
    private RendererKind renderer = RendererKind.BROWSER;
    private Path reportPath;

    // ---------- getters ----------
    public List<String> getSeeds() { return List.copyOf(seeds); }
    public Integer getMaxDepth() { return maxDepth; }
    public boolean hasDepthLimit() { return maxDepth != null; }
    public String getInclude() { return include; }
    public String getExclude() { return exclude; }
    public String getPrintStatus() { return printStatus; }
    public boolean isCheckImages() { return checkImages; }
    public Path getSaveImagesDir() { return saveImagesDir; }
    public Path getScreenshotDir() { return screenshotDir; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public String getExecute() { return execute; }
    public Duration getWaitBeforeExtract() { return waitBeforeExtract; }
    public String getHttpBasic() { return httpBasic; }
    public boolean isIgnoreRobots() { return ignoreRobots; }
    public int getConcurrency() { return concurrency; }
    public Duration getTimeout() { return timeout; }
    public int getRps() { return rps; }
    public String getUserAgent() { return userAgent; }
    public RendererKind getRenderer() { return renderer; }
    public Path getReportPath() { return reportPath; }

    /** 이미지 상태 확인이 필요한지(저장 모드는 확인을 포함한다) */
    public boolean isImageHandlingEnabled() { return checkImages || saveImagesDir != null; }

    // ---------- fluent setters ----------
    public CrawlConfig addSeed(String seed) {
        if (seed != null && !seed.isBlank()) seeds.add(seed.trim());
        return this;
    }
    public CrawlConfig setSeeds(List<String> list) {
        seeds.clear();
        if (list != null) list.forEach(this::addSeed);
        return this;
    }
    public CrawlConfig setMaxDepth(Integer maxDepth) { this.maxDepth = maxDepth; return this; }
    public CrawlConfig setInclude(String include) { this.include = blankToNull(include); return this; }
    public CrawlConfig setExclude(String exclude) { this.exclude = blankToNull(exclude); return this; }
    public CrawlConfig setPrintStatus(String printStatus) {
        this.printStatus = (printStatus == null ? DEFAULT_PRINT_STATUS : printStatus);
        return this;
    }
    public CrawlConfig setCheckImages(boolean v) { this.checkImages = v; return this; }
    public CrawlConfig setSaveImagesDir(Path dir) { this.saveImagesDir = dir; return this; }
    public CrawlConfig setScreenshotDir(Path dir) { this.screenshotDir = dir; return this; }
    public CrawlConfig setWidth(int width) { this.width = width; return this; }
    public CrawlConfig setHeight(int height) { this.height = height; return this; }
    public CrawlConfig setExecute(String command) { this.execute = blankToNull(command); return this; }
    public CrawlConfig setWaitBeforeExtract(Duration wait) { this.waitBeforeExtract = wait; return this; }
    public CrawlConfig setHttpBasic(String userPass) { this.httpBasic = blankToNull(userPass); return this; }
    public CrawlConfig setIgnoreRobots(boolean v) { this.ignoreRobots = v; return this; }
    public CrawlConfig setConcurrency(int concurrency) { this.concurrency = concurrency; return this; }
    public CrawlConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public CrawlConfig setRps(int rps) { this.rps = rps; return this; }
    public CrawlConfig setUserAgent(String ua) {
        this.userAgent = (ua == null || ua.isBlank()) ? DEFAULT_USER_AGENT : ua.trim();
        return this;
    }
    public CrawlConfig setRenderer(RendererKind kind) {
        this.renderer = (kind != null ? kind : RendererKind.BROWSER);
        return this;
    }
    public CrawlConfig setReportPath(Path reportPath) { this.reportPath = reportPath; return this; }

    // ---------- validate ----------
    public void validate() {
        if (seeds.isEmpty()) throw new IllegalArgumentException("at least one seed URL is required");
        for (String s : seeds) {
            String lower = s.toLowerCase(Locale.ROOT);
            if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
                throw new IllegalArgumentException("seed must be an absolute http(s) URL: " + s);
            }
        }
        if (maxDepth != null && maxDepth < 0) throw new IllegalArgumentException("depth must be >= 0");
        compile("include", include);
        compile("exclude", exclude);
        compile("print-status", printStatus);
        if (width < 1 || height < 1) throw new IllegalArgumentException("width/height must be >= 1");
        Objects.requireNonNull(waitBeforeExtract, "wait");
        if (waitBeforeExtract.isNegative()) throw new IllegalArgumentException("wait must be >= 0");
        if (httpBasic != null && httpBasic.indexOf(':') < 0) {
            throw new IllegalArgumentException("http-basic must be in user:pass form");
        }
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (rps < 0) throw new IllegalArgumentException("rps must be >= 0");
        Objects.requireNonNull(renderer, "renderer");
    }

    // ---------- helpers ----------
    public static CrawlConfig defaults() { return new CrawlConfig(); }

    /** 정규식 컴파일(없으면 null). 문법 오류는 설정 오류로 변환 */
    public static Pattern compile(String name, String regex) {
        if (regex == null) return null;
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("invalid " + name + " pattern: " + e.getDescription(), e);
        }
    }

    public long getTimeoutMs() { return timeout.toMillis(); }

    /** jsoup/Playwright 등 int ms 필요 시 */
    public int getTimeoutMsInt() {
        long ms = getTimeoutMs();
        return (ms > Integer.MAX_VALUE) ? Integer.MAX_VALUE : (int) ms;
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }
}
