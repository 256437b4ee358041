package com.linkscout.core.report;

import com.linkscout.core.model.CrawlConfig;
import com.linkscout.core.model.CrawlStats;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class JsonCrawlReportWriterTest {

    @Test
    void writesIsoTimestampsAndCounts(@TempDir Path tmp) throws Exception {
        CrawlConfig cfg = CrawlConfig.defaults().addSeed("http://a.test").setMaxDepth(2).setExclude("^mailto");
        CrawlStats stats = new CrawlStats();
        stats.addVisited();
        stats.addVisited();
        stats.addUnreachable();
        stats.observeConcurrency(1);
        CrawlReport report = CrawlReport.of(cfg, stats.snapshot(),
                Instant.parse("2024-05-01T10:00:00Z"), Instant.parse("2024-05-01T10:00:05Z"));

        Path file = new JsonCrawlReportWriter().write(report, tmp.resolve("out/report.json"));

        String json = Files.readString(file);
        assertThat(json).contains("\"startedAt\" : \"2024-05-01T10:00:00Z\"");
        assertThat(json).contains("\"renderer\" : \"browser\"");

        CrawlReport back = new JsonCrawlReportWriter().read(file);
        assertThat(back).isEqualTo(report);
        assertThat(back.counts().visited()).isEqualTo(2);
        assertThat(back.counts().unreachable()).isEqualTo(1);
        assertThat(back.meta().depth()).isEqualTo(2);
    }
}
