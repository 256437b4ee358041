package com.linkscout.core.report;

import com.linkscout.core.model.CrawlConfig;
import com.linkscout.core.model.CrawlStats;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/** {@code --report} JSON 문서 */
public record CrawlReport(Meta meta, Counts counts) {

    public record Meta(Instant startedAt,
                       Instant finishedAt,
                       List<String> seeds,
                       Integer depth,
                       String include,
                       String exclude,
                       int concurrency,
                       boolean ignoreRobots,
                       String renderer) {}

    public record Counts(long visited,
                         long unreachable,
                         long robotsSkipped,
                         long excluded,
                         long imagesChecked,
                         long imagesSaved,
                         int maxObservedConcurrency) {}

    public static CrawlReport of(CrawlConfig cfg, CrawlStats.Snapshot s, Instant startedAt, Instant finishedAt) {
        Meta meta = new Meta(startedAt, finishedAt, cfg.getSeeds(), cfg.getMaxDepth(),
                cfg.getInclude(), cfg.getExclude(), cfg.getConcurrency(), cfg.isIgnoreRobots(),
                cfg.getRenderer().name().toLowerCase(Locale.ROOT));
        Counts counts = new Counts(s.visited(), s.unreachable(), s.robotsSkipped(), s.excluded(),
                s.imagesChecked(), s.imagesSaved(), s.maxObservedConcurrency());
        return new CrawlReport(meta, counts);
    }
}
