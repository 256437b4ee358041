package com.linkscout.app.cli;

import com.linkscout.core.model.CrawlConfig;
import com.linkscout.core.util.YamlConfigLoader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 명령행 해석: 위치 인자는 시드, 옵션은 {@code --key=value} 또는 {@code --flag}.
 * {@code --config} 파일을 먼저 적용하고 나머지 옵션으로 덮어쓴 뒤 검증한다.
 * 잘못된 입력은 모두 {@link IllegalArgumentException}.
 */
public final class CliArgs {

    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: linkscout [options] <seed-url>...",
            "",
            "Scope:",
            "  --depth=<n>              recursion bound (default: unbounded)",
            "  --include=<regex>        in-scope pattern, anchored at the URL start",
            "  --exclude=<regex>        never visit or report matching links",
            "  --ignore-robots          do not consult robots.txt",
            "Output:",
            "  --print-status=<regex>   print only matching status codes (default: .*)",
            "  --report=<file>          write a JSON summary after the crawl",
            "Side effects:",
            "  --check-images           check <img src> status codes",
            "  --save-images=<dir>      download images into <dir>",
            "  --screenshot=<dir>       save a PNG per visited page",
            "  --width=<px>             screenshot viewport width (default: 1280)",
            "  --height=<px>            screenshot viewport height (default: 800)",
            "  --execute=<command>      pipe each page's HTML into `sh -c <command>`",
            "Fetching:",
            "  --wait=<seconds>         delay after load before extracting links (default: 0)",
            "  --http-basic=<user:pass> basic auth for every request",
            "  --static                 fetch with jsoup instead of a headless browser",
            "  --concurrency=<n>        parallel workers (default: 1)",
            "  --timeout=<seconds>      per-request timeout (default: 30)",
            "  --rps=<n>                global requests per second, 0 = unlimited (default: 0)",
            "  --user-agent=<ua>        (default: " + CrawlConfig.DEFAULT_USER_AGENT + ")",
            "Misc:",
            "  --config=<yaml>          load options from a YAML file (flags override it)",
            "  --log-level=<level>      DEBUG, INFO, WARN, ERROR (default: WARN)",
            "  --help                   show this help");

    private final CrawlConfig config;
    private final String logLevel;
    private final boolean help;

    private CliArgs(CrawlConfig config, String logLevel, boolean help) {
        this.config = config;
        this.logLevel = logLevel;
        this.help = help;
    }

    public CrawlConfig config() { return config; }
    public String logLevel() { return logLevel; }
    public boolean help() { return help; }

    public static CliArgs parse(String[] args) {
        List<String> seeds = new ArrayList<>();
        List<String[]> options = new ArrayList<>();
        Path configFile = null;
        String logLevel = null;

        boolean onlySeeds = false;
        for (String arg : args) {
            if (onlySeeds || !arg.startsWith("--")) {
                seeds.add(arg);
                continue;
            }
            if (arg.equals("--")) {
                onlySeeds = true;
                continue;
            }
            int eq = arg.indexOf('=');
            String key = (eq < 0) ? arg.substring(2) : arg.substring(2, eq);
            String value = (eq < 0) ? null : arg.substring(eq + 1);
            switch (key) {
                case "help":
                    return new CliArgs(null, null, true);
                case "config":
                    configFile = Path.of(required(key, value));
                    break;
                case "log-level":
                    logLevel = required(key, value);
                    break;
                default:
                    options.add(new String[]{key, value});
            }
        }

        CrawlConfig cfg = CrawlConfig.defaults();
        if (configFile != null) {
            try {
                YamlConfigLoader.applyTo(cfg, configFile);
            } catch (IOException e) {
                throw new IllegalArgumentException("cannot read config: " + e.getMessage(), e);
            }
        }
        for (String[] kv : options) apply(cfg, kv[0], kv[1]);
        if (!seeds.isEmpty()) cfg.setSeeds(seeds);

        cfg.validate();
        return new CliArgs(cfg, logLevel, false);
    }

    private static void apply(CrawlConfig cfg, String key, String value) {
        switch (key) {
            case "depth" -> cfg.setMaxDepth(intValue(key, value));
            case "include" -> cfg.setInclude(required(key, value));
            case "exclude" -> cfg.setExclude(required(key, value));
            case "print-status" -> cfg.setPrintStatus(required(key, value));
            case "check-images" -> cfg.setCheckImages(flag(key, value));
            case "save-images" -> cfg.setSaveImagesDir(Path.of(required(key, value)));
            case "screenshot" -> cfg.setScreenshotDir(Path.of(required(key, value)));
            case "width" -> cfg.setWidth(intValue(key, value));
            case "height" -> cfg.setHeight(intValue(key, value));
            case "execute" -> cfg.setExecute(required(key, value));
            case "wait" -> cfg.setWaitBeforeExtract(YamlConfigLoader.parseSeconds(key, required(key, value)));
            case "http-basic" -> cfg.setHttpBasic(required(key, value));
            case "ignore-robots" -> cfg.setIgnoreRobots(flag(key, value));
            case "concurrency" -> cfg.setConcurrency(intValue(key, value));
            case "timeout" -> cfg.setTimeout(YamlConfigLoader.parseSeconds(key, required(key, value)));
            case "rps" -> cfg.setRps(intValue(key, value));
            case "user-agent" -> cfg.setUserAgent(required(key, value));
            case "static" -> cfg.setRenderer(flag(key, value)
                    ? CrawlConfig.RendererKind.STATIC : CrawlConfig.RendererKind.BROWSER);
            case "report" -> cfg.setReportPath(Path.of(required(key, value)));
            default -> throw new IllegalArgumentException("unknown option --" + key);
        }
    }

    private static String required(String key, String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("--" + key + " needs a value (--" + key + "=...)");
        }
        return value;
    }

    /** {@code --flag} 또는 {@code --flag=true|false} */
    private static boolean flag(String key, String value) {
        if (value == null) return true;
        if (value.equalsIgnoreCase("true")) return true;
        if (value.equalsIgnoreCase("false")) return false;
        throw new IllegalArgumentException("--" + key + " takes no value or true/false");
    }

    private static int intValue(String key, String value) {
        try {
            return Integer.parseInt(required(key, value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + key + " must be an integer: " + value, e);
        }
    }
}
