package com.linkscout.core.crawler;

import com.linkscout.core.crawler.robots.RobotsGate;
import com.linkscout.core.model.CrawlTarget;
import com.linkscout.core.model.ScopeConfig;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 시드 하나의 크롤 문맥: 스코프, robots 게이트, 작업 덱.
 * <p>
 * 자식은 덱 앞쪽에 문서 순서대로 놓이므로 워커가 하나면 깊이 우선으로 방문한다.
 * pending 은 "큐에 있음 + 처리 중" 개수이며, 자식 push 가 부모 done 보다 먼저
 * 일어나므로 0 이 되면 더 이상 할 일이 없다.
 */
public final class CrawlSession {

    private final ScopeConfig scope;
    private final RobotsGate robots;
    private final BlockingDeque<CrawlTarget> deque = new LinkedBlockingDeque<>();
    private final AtomicInteger pending = new AtomicInteger(0);

    public CrawlSession(ScopeConfig scope, RobotsGate robots) {
        this.scope = Objects.requireNonNull(scope, "scope");
        this.robots = Objects.requireNonNull(robots, "robots");
    }

    public ScopeConfig scope() { return scope; }
    public RobotsGate robots() { return robots; }

    public void push(CrawlTarget target) {
        pending.incrementAndGet();
        deque.addFirst(target);
    }

    public void pushChildren(List<CrawlTarget> children) {
        for (int i = children.size() - 1; i >= 0; i--) {
            push(children.get(i));
        }
    }

    public CrawlTarget poll(long timeout, TimeUnit unit) throws InterruptedException {
        return deque.pollFirst(timeout, unit);
    }

    /** poll 로 꺼낸 대상 처리가 끝났을 때 한 번 */
    public void done() {
        pending.decrementAndGet();
    }

    public boolean isDrained() {
        return pending.get() == 0;
    }
}
