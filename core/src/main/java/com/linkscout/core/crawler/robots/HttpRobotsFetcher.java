package com.linkscout.core.crawler.robots;

import com.linkscout.core.util.BasicAuth;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * java.net.http 기반 robots.txt fetch. 클라이언트는 리다이렉트를 따라가지 않아야 한다
 * (HttpClient 기본값 Redirect.NEVER). 모든 실패는 {@link Response#fail} 로 돌려준다.
 */
public final class HttpRobotsFetcher implements RobotsFetcher {
    private final HttpClient client;
    private final String userAgent;
    private final Duration timeout;
    private final BasicAuth auth;

    public HttpRobotsFetcher(HttpClient client, String userAgent, Duration timeout, BasicAuth auth) {
        this.client = Objects.requireNonNull(client, "client");
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.auth = auth;
    }

    @Override
    public Response fetch(URI robotsTxtUri) {
        HttpRequest.Builder rb = HttpRequest.newBuilder(robotsTxtUri)
                .GET()
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Accept", "text/plain,*/*;q=0.8");
        if (auth != null) rb.header("Authorization", auth.headerValue());

        try {
            HttpResponse<String> res = client.send(rb.build(),
                    HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            int code = res.statusCode();
            if (code == 301 || code == 302 || code == 307 || code == 308) {
                URI next = res.headers().firstValue("Location")
                        .map(robotsTxtUri::resolve)
                        .orElse(robotsTxtUri);
                return Response.redirect(code, next);
            }
            return Response.ok(code, res.body(), robotsTxtUri);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return Response.fail("interrupted", robotsTxtUri);
        } catch (IOException | IllegalArgumentException e) {
            return Response.fail(e.toString(), robotsTxtUri);
        }
    }
}
