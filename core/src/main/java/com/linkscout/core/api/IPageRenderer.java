package com.linkscout.core.api;

import java.net.URI;

/** URL 하나를 불러와 상태 코드와 DOM 을 돌려준다. 여러 워커가 동시에 호출한다. */
public interface IPageRenderer extends AutoCloseable {

    RenderedPage render(URI url) throws RenderException;

    @Override default void close() {}
}
