package com.linkscout.core.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** 크롤 요약을 JSON 파일로 남긴다(ISO-8601 시각, pretty print). */
public final class JsonCrawlReportWriter {
    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public Path write(CrawlReport report, Path file) throws IOException {
        if (report == null) throw new IllegalArgumentException("report is null");
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        om.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), report);
        return file;
    }

    public CrawlReport read(Path file) throws IOException {
        return om.readValue(file.toFile(), CrawlReport.class);
    }
}
