package com.linkscout.core.api;

import com.linkscout.core.model.CrawlTarget;

/** 도달한 페이지마다 한 번 호출되는 부수효과. 결과는 순회에 영향을 주지 않는다. */
@FunctionalInterface
public interface PageSink {

    void accept(CrawlTarget target, RenderedPage page) throws Exception;

    default String name() {
        return getClass().getSimpleName();
    }
}
