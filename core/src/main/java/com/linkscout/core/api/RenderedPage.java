package com.linkscout.core.api;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * 렌더된 페이지 한 장. 방문 처리가 끝나면 닫는다(브라우저 탭 등 해제).
 */
public interface RenderedPage extends AutoCloseable {

    int statusCode();

    /** 리다이렉트 후 최종 URL. 상대 링크 해석 기준 */
    String location();

    /** {@code a[href]} 원시 값, 문서 순서 */
    List<String> links();

    /** {@code img[src]} 원시 값, 문서 순서 */
    List<String> images();

    /** 렌더된 HTML 직렬화 */
    String body();

    default void screenshot(Path file) throws IOException {
        throw new UnsupportedOperationException("screenshots need the browser renderer");
    }

    default boolean supportsScreenshot() {
        return false;
    }

    @Override default void close() {}
}
