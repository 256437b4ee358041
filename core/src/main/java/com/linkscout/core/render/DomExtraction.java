package com.linkscout.core.render;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/** 렌더된 DOM 에서 원시 링크/이미지 값을 문서 순서대로 뽑는다. 해석은 LinkNormalizer 몫. */
final class DomExtraction {
    private DomExtraction() {}

    static List<String> links(Document doc) {
        return attrs(doc, "a[href]", "href");
    }

    static List<String> images(Document doc) {
        return attrs(doc, "img[src]", "src");
    }

    private static List<String> attrs(Document doc, String css, String attr) {
        List<String> out = new ArrayList<>();
        for (Element e : doc.select(css)) {
            String v = e.attr(attr);
            if (!v.isBlank()) out.add(v.trim());
        }
        return out;
    }
}
