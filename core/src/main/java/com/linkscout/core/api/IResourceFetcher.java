package com.linkscout.core.api;

import com.linkscout.core.model.FetchResult;

import java.io.IOException;
import java.net.URI;

/** 탐색 대상이 아닌 리소스(이미지)용 GET */
public interface IResourceFetcher {

    /**
     * @param withBody false 면 본문을 버리고 상태만, true 면 본문까지
     */
    FetchResult fetch(URI url, boolean withBody) throws IOException;
}
