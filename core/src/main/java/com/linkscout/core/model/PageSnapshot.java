package com.linkscout.core.model;

import com.linkscout.core.api.RenderedPage;

import java.util.List;
import java.util.Objects;

/** 정적 렌더 결과(스크린샷 없음). 테스트 더블로도 쓴다. */
public record PageSnapshot(int statusCode, String location, List<String> links, List<String> images, String body)
        implements RenderedPage {

    public PageSnapshot {
        Objects.requireNonNull(location, "location");
        links = (links == null) ? List.of() : List.copyOf(links);
        images = (images == null) ? List.of() : List.copyOf(images);
        body = (body == null) ? "" : body;
    }
}
