package com.linkscout.core.crawler.robots;

import java.net.URI;
import java.util.Optional;

/** robots.txt 원문 공급자. 리다이렉트 추적은 {@link RobotsRepository} 가 한다. */
public interface RobotsFetcher {

    /**
     * @param status   HTTP 상태 (0 이면 네트워크 오류 등 응답 없음)
     * @param body     본문(2xx 일 때만 의미 있음)
     * @param finalUri 리다이렉트면 Location 을 해석한 다음 URI, 아니면 요청 URI
     * @param error    실패 사유
     */
    record Response(int status, String body, URI finalUri, Optional<String> error) {
        public Response {
            body = (body == null) ? "" : body;
            error = (error == null) ? Optional.empty() : error;
        }

        public static Response ok(int status, String body, URI finalUri) {
            return new Response(status, body, finalUri, Optional.empty());
        }

        public static Response redirect(int status, URI next) {
            return new Response(status, "", next, Optional.empty());
        }

        public static Response fail(String msg, URI finalUri) {
            return new Response(0, "", finalUri, Optional.ofNullable(msg));
        }

        public boolean isNetworkError() { return status == 0; }
    }

    Response fetch(URI robotsTxtUri);
}
