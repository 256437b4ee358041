package com.linkscout.core.crawler;

import com.linkscout.core.model.VisitOutcome;

import java.io.PrintStream;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 방문 결과를 {@code <code>\t<url>} 한 줄로 출력. 상태 문자열이 필터 패턴에
 * (시작 고정으로) 매칭될 때만 찍는다. 순회 판단에는 관여하지 않는다.
 */
public final class StatusReporter {

    private final Pattern filter;
    private final PrintStream out;

    public StatusReporter(Pattern filter, PrintStream out) {
        this.filter = (filter != null ? filter : Pattern.compile(".*"));
        this.out = Objects.requireNonNull(out, "out");
    }

    public StatusReporter(PrintStream out) {
        this(null, out);
    }

    public void report(VisitOutcome outcome) {
        report(outcome.statusLabel(), outcome.url());
    }

    public void report(String statusLabel, String url) {
        if (!filter.matcher(statusLabel).lookingAt()) return;
        // 워커 여러 개가 동시에 찍어도 줄이 섞이지 않게
        synchronized (out) {
            out.println(statusLabel + "\t" + url);
            out.flush();
        }
    }
}
