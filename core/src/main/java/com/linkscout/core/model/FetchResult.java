package com.linkscout.core.model;

import java.util.Objects;

/** 이미지 등 단순 리소스 응답. 본문을 버렸다면 body 는 빈 배열 */
public record FetchResult(String url, int statusCode, String contentType, byte[] body) {

    public FetchResult {
        Objects.requireNonNull(url, "url");
        body = (body == null) ? new byte[0] : body;
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
