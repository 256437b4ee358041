package com.linkscout.core.api;

import com.linkscout.core.model.CrawlStats;

import java.util.List;

/** 크롤러 최소 계약: 시드 목록을 끝까지 순회하고 통계를 돌려준다. */
public interface ICrawler extends AutoCloseable {

    CrawlStats.Snapshot crawl(List<String> seeds) throws InterruptedException;

    /** 새 방문 스케줄을 멈춘다. 진행 중인 방문은 끝까지 간다. */
    void stop();

    @Override default void close() throws Exception {}
}
