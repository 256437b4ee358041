package com.linkscout.app.app;

import com.linkscout.app.cli.CliArgs;
import com.linkscout.app.logging.LogSetup;
import com.linkscout.core.model.CrawlStats;
import com.linkscout.core.service.CrawlService;

import java.io.PrintStream;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * CLI 진입점. 종료 코드: 0 완료(도달 불가 페이지가 있어도), 2 설정 오류, 1 그 밖의 치명적 오류.
 */
public final class App {
    private static final Logger LOG = Logger.getLogger(App.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_CONFIG = 2;

    private static final Duration SHUTDOWN_SLACK = Duration.ofSeconds(5);

    private App() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CliArgs cli;
        try {
            cli = CliArgs.parse(args);
            LogSetup.init(cli.logLevel());
        } catch (IllegalArgumentException e) {
            err.println("linkscout: " + e.getMessage());
            err.println();
            err.println(CliArgs.USAGE);
            return EXIT_CONFIG;
        }
        if (cli.help()) {
            out.println(CliArgs.USAGE);
            return EXIT_OK;
        }

        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.log(Level.SEVERE, "Uncaught exception in " + t.getName(), e));

        // 크롤이 끝나고(리포트 기록, 렌더러 정리 포함) 나서 열린다
        CountDownLatch finished = new CountDownLatch(1);
        Duration grace = cli.config().getTimeout().plus(SHUTDOWN_SLACK);
        try (CrawlService service = new CrawlService(cli.config(), out)) {
            Thread hook = new Thread(() -> stopAndAwait(service, finished, grace), "linkscout-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);
            try {
                CrawlStats.Snapshot s = service.run();
                LOG.info(() -> "Finished: visited=" + s.visited() + ", unreachable=" + s.unreachable());
            } finally {
                removeHook(hook);
            }
            return EXIT_OK;
        } catch (IllegalArgumentException e) {
            err.println("linkscout: " + e.getMessage());
            return EXIT_CONFIG;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warning("Interrupted");
            return EXIT_FATAL;
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Crawl failed", e);
            err.println("linkscout: " + e);
            return EXIT_FATAL;
        } finally {
            finished.countDown();
        }
    }

    /**
     * 셧다운 훅 본체: 새 방문을 막고, 진행 중인 방문과 리포트 기록이 끝날 때까지 최대 grace 만큼 기다린다.
     * 훅이 반환하면 JVM 이 멈추므로 여기서 기다려야 한다.
     */
    static boolean stopAndAwait(CrawlService service, CountDownLatch finished, Duration grace) {
        service.stop();
        try {
            boolean done = finished.await(grace.toMillis(), TimeUnit.MILLISECONDS);
            if (!done) {
                LOG.warning("Crawl did not finish within " + grace.toMillis() + " ms of shutdown");
            }
            return done;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException ignored) {
            // JVM 이 이미 종료 중
        }
    }
}
