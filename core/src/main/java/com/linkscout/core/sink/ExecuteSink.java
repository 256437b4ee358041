package com.linkscout.core.sink;

import com.linkscout.core.api.PageSink;
import com.linkscout.core.api.RenderedPage;
import com.linkscout.core.model.CrawlTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@code --execute=<cmd>}: 페이지마다 {@code sh -c <cmd>} 를 띄우고 렌더된 본문을 stdin 으로 넣는다.
 * 프로세스 stdout 은 끝난 뒤 한 덩어리로 출력 스트림에 찍고, stderr 는 그대로 물려준다.
 * 제한 시간을 넘기면 프로세스를 죽이고 실패로 본다.
 */
public final class ExecuteSink implements PageSink {
    private static final Logger LOG = LoggerFactory.getLogger(ExecuteSink.class);

    private final String command;
    private final Duration timeout;
    private final PrintStream out;

    public ExecuteSink(String command, Duration timeout, PrintStream out) {
        this.command = Objects.requireNonNull(command, "command");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void accept(CrawlTarget target, RenderedPage page) throws IOException, InterruptedException {
        Process p = new ProcessBuilder(List.of("sh", "-c", command))
                .redirectError(ProcessBuilder.Redirect.INHERIT)
                .start();

        // stdin/stdout 을 각각 다른 스레드가 맡아야 큰 본문에서도 파이프가 막히지 않는다
        Thread feeder = daemon(() -> feed(p, page.body(), target.url()), "execute-stdin");
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        Thread drainer = daemon(() -> drain(p, stdout, target.url()), "execute-stdout");

        try {
            if (!p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new IOException("command timed out after " + timeout.toSeconds() + "s");
            }
            drainer.join(timeout.toMillis());
            feeder.join(1000L);
        } finally {
            if (p.isAlive()) p.destroyForcibly();
        }

        if (stdout.size() > 0) {
            synchronized (out) {
                stdout.writeTo(out);
                out.flush();
            }
        }
        int code = p.exitValue();
        if (code != 0) LOG.debug("execute exited with {} for {}", code, target.url());
    }

    private static Thread daemon(Runnable r, String name) {
        Thread t = new Thread(r, name);
        t.setDaemon(true);
        t.start();
        return t;
    }

    private static void drain(Process p, ByteArrayOutputStream sink, String url) {
        try (InputStream in = p.getInputStream()) {
            in.transferTo(sink);
        } catch (IOException e) {
            LOG.debug("stdout read failed for {}: {}", url, e.getMessage());
        }
    }

    private static void feed(Process p, String body, String url) {
        try (OutputStream stdin = p.getOutputStream()) {
            stdin.write(body.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            // 명령이 stdin 을 읽지 않고 끝나면 broken pipe
            LOG.debug("stdin closed early for {}: {}", url, e.getMessage());
        }
    }

    @Override public String name() { return "execute"; }
}
