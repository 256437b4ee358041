package com.linkscout.core.util;

import com.linkscout.core.model.CrawlConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * crawl.yml 을 읽어 {@link CrawlConfig} 에 덮어쓴다. 키는 CLI 긴 옵션의 camelCase.
 *
 * <pre>
 * seeds: ["https://example.com"]
 * depth: 2
 * include: "^https://example\\.com/docs"
 * exclude: "^mailto"
 * printStatus: "[45]"
 * checkImages: true
 * saveImages: "out/images"
 * screenshot: "out/shots"
 * width: 1280
 * height: 800
 * execute: "wc -c"
 * wait: 1.5
 * httpBasic: "user:pass"
 * ignoreRobots: false
 * concurrency: 4
 * timeoutSeconds: 30
 * rps: 5
 * userAgent: "LinkScout/1.0"
 * static: true
 * report: "out/report.json"
 * </pre>
 * 검증은 하지 않는다. CLI 값까지 합친 뒤 호출자가 {@link CrawlConfig#validate()}.
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static CrawlConfig load(Path yamlPath) throws IOException {
        return applyTo(CrawlConfig.defaults(), yamlPath);
    }

    public static CrawlConfig applyTo(CrawlConfig cfg, Path yamlPath) throws IOException {
        Objects.requireNonNull(cfg, "cfg");
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("config file not found at: " + yamlPath.toAbsolutePath());
        }
        Object root;
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            root = yaml.load(in);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("invalid YAML in " + yamlPath + ": " + e.getMessage(), e);
        }
        if (!(root instanceof Map<?, ?> map)) {
            return cfg; // 비어 있거나 스칼라면 그대로
        }

        setStringList(map, "seeds", cfg::setSeeds);
        setInt(map, "depth", cfg::setMaxDepth);
        setString(map, "include", cfg::setInclude);
        setString(map, "exclude", cfg::setExclude);
        setString(map, "printStatus", cfg::setPrintStatus);
        setBoolean(map, "checkImages", cfg::setCheckImages);
        setPath(map, "saveImages", cfg::setSaveImagesDir);
        setPath(map, "screenshot", cfg::setScreenshotDir);
        setInt(map, "width", cfg::setWidth);
        setInt(map, "height", cfg::setHeight);
        setString(map, "execute", cfg::setExecute);
        setSeconds(map, "wait", cfg::setWaitBeforeExtract);
        setString(map, "httpBasic", cfg::setHttpBasic);
        setBoolean(map, "ignoreRobots", cfg::setIgnoreRobots);
        setInt(map, "concurrency", cfg::setConcurrency);
        setSeconds(map, "timeoutSeconds", cfg::setTimeout);
        setInt(map, "rps", cfg::setRps);
        setString(map, "userAgent", cfg::setUserAgent);
        setBoolean(map, "static", b -> cfg.setRenderer(b ? CrawlConfig.RendererKind.STATIC : CrawlConfig.RendererKind.BROWSER));
        setPath(map, "report", cfg::setReportPath);
        return cfg;
    }

    /** "1.5" → 1500ms. 음수/숫자 아님은 설정 오류 */
    public static Duration parseSeconds(String key, String value) {
        try {
            double sec = Double.parseDouble(value.trim());
            if (sec < 0 || Double.isNaN(sec) || Double.isInfinite(sec)) {
                throw new IllegalArgumentException(key + " must be a non-negative number of seconds");
            }
            return Duration.ofMillis(Math.round(sec * 1000.0));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number of seconds: " + value, e);
        }
    }

    // ------------ helpers ------------
    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
        } else {
            // "a,b" 형태도 허용
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        if (!out.isEmpty()) setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) {
            setter.accept(n.intValue());
        } else if (v != null) {
            try {
                setter.accept(Integer.parseInt(String.valueOf(v).trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be an integer: " + v, e);
            }
        }
    }

    private static void setSeconds(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(parseSeconds(key, String.valueOf(v)));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }
}
