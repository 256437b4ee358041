package com.linkscout.core.render;

import com.linkscout.core.api.IPageRenderer;
import com.linkscout.core.api.RenderException;
import com.linkscout.core.api.RenderedPage;
import com.linkscout.core.model.CrawlConfig;
import com.linkscout.core.model.PageSnapshot;
import com.linkscout.core.util.BasicAuth;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.io.IOException;
import java.net.URI;
import java.util.Locale;

/**
 * jsoup 정적 렌더러({@code --static}). 스크립트는 실행하지 않는다.
 * 4xx/5xx 도 응답이므로 상태 코드로 돌려주고, 연결 실패/타임아웃/지원하지 않는 URL 은 {@link RenderException}.
 */
public class JsoupPageRenderer implements IPageRenderer {
    private final int timeoutMs;
    private final String userAgent;
    private final BasicAuth auth;

    public JsoupPageRenderer(CrawlConfig config) {
        this(config.getTimeoutMsInt(), config.getUserAgent(), BasicAuth.parse(config.getHttpBasic()));
    }

    public JsoupPageRenderer(int timeoutMs, String userAgent, BasicAuth auth) {
        this.timeoutMs = Math.max(0, timeoutMs);
        this.userAgent = userAgent;
        this.auth = auth;
    }

    @Override
    public RenderedPage render(URI url) throws RenderException {
        try {
            // tel:, sms: 같은 비 HTTP URL 은 connect 단계에서 IllegalArgumentException
            Connection conn = Jsoup.connect(url.toString())
                    .userAgent(userAgent)
                    .timeout(timeoutMs)
                    .followRedirects(true)
                    .ignoreHttpErrors(true)
                    .ignoreContentType(true);
            if (auth != null) conn.header("Authorization", auth.headerValue());

            Connection.Response res = conn.execute();
            String location = res.url().toString();
            if (!isHtml(res.contentType())) {
                return new PageSnapshot(res.statusCode(), location, null, null, res.body());
            }
            Document doc = res.parse();
            return new PageSnapshot(res.statusCode(), location,
                    DomExtraction.links(doc), DomExtraction.images(doc), doc.outerHtml());
        } catch (IOException | IllegalArgumentException e) {
            throw new RenderException(url + ": " + e.getMessage(), e);
        }
    }

    private static boolean isHtml(String contentType) {
        if (contentType == null) return true;
        String ct = contentType.toLowerCase(Locale.ROOT);
        return ct.contains("html") || ct.contains("xml");
    }
}
