package com.linkscout.core.http;

import com.linkscout.core.api.IResourceFetcher;
import com.linkscout.core.model.CrawlConfig;
import com.linkscout.core.model.FetchResult;
import com.linkscout.core.util.BasicAuth;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * 이미지 상태 확인/다운로드용 GET. 리다이렉트는 따라가며, 4xx/5xx 도 상태 코드로 돌려준다.
 * 연결 실패·타임아웃만 {@link IOException}.
 */
public class HttpResourceFetcher implements IResourceFetcher {
    private final HttpClient client;
    private final String userAgent;
    private final Duration timeout;
    private final BasicAuth auth;

    public HttpResourceFetcher(CrawlConfig config) {
        this(newClient(config.getTimeout()), config.getUserAgent(), config.getTimeout(),
                BasicAuth.parse(config.getHttpBasic()));
    }

    public HttpResourceFetcher(HttpClient client, String userAgent, Duration timeout, BasicAuth auth) {
        this.client = Objects.requireNonNull(client, "client");
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.auth = auth;
    }

    public static HttpClient newClient(Duration connectTimeout) {
        return HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public FetchResult fetch(URI url, boolean withBody) throws IOException {
        HttpRequest.Builder rb = HttpRequest.newBuilder(url)
                .GET()
                .timeout(timeout)
                .header("User-Agent", userAgent);
        if (auth != null) rb.header("Authorization", auth.headerValue());

        HttpRequest req;
        try {
            req = rb.build();
        } catch (IllegalArgumentException e) {
            throw new IOException("unsupported URL " + url, e);
        }
        try {
            if (withBody) {
                HttpResponse<byte[]> res = client.send(req, HttpResponse.BodyHandlers.ofByteArray());
                return new FetchResult(url.toString(), res.statusCode(), contentType(res), res.body());
            }
            HttpResponse<Void> res = client.send(req, HttpResponse.BodyHandlers.discarding());
            return new FetchResult(url.toString(), res.statusCode(), contentType(res), null);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while fetching " + url);
        }
    }

    private static String contentType(HttpResponse<?> res) {
        return res.headers().firstValue("Content-Type").orElse(null);
    }
}
