package com.linkscout.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 전역 설정. slf4j-jdk14 를 통해 core 의 SLF4J 로그도 여기로 온다.
 * - 콘솔은 stderr (stdout 은 상태 줄 전용)
 * - -Dls.log.dir 가 있으면 사이즈 롤링 파일 추가(기본 2MB x 5)
 * System props:
 *  -Dls.log.level=FINE|INFO|WARNING|SEVERE (기본 WARNING)
 *  -Dls.log.sizeMb=2
 *  -Dls.log.files=5
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false;
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    /** --log-level 이 없으면 -Dls.log.level, 그것도 없으면 WARNING */
    public static synchronized void init(String levelName) {
        if (initialized) return;
        initialized = true;

        Level level = (levelName != null)
                ? levelOf(levelName)
                : levelOf(System.getProperty("ls.log.level", "WARNING"));

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(level);
        console.setFormatter(LINE_FORMATTER);
        root.addHandler(console);

        String dir = System.getProperty("ls.log.dir");
        if (dir != null && !dir.isBlank()) {
            addFileHandler(root, Path.of(dir), level);
        }
        root.setLevel(level);
    }

    /**
     * 문자열 → Level. JUL 이름 외에 SLF4J 식 이름(DEBUG/WARN/ERROR/TRACE)도 받는다.
     * 알 수 없는 이름은 설정 오류.
     */
    public static Level levelOf(String name) {
        String s = String.valueOf(name).trim().toUpperCase(Locale.ROOT);
        switch (s) {
            case "TRACE": return Level.FINEST;
            case "DEBUG": return Level.FINE;
            case "WARN":  return Level.WARNING;
            case "ERROR": return Level.SEVERE;
            default:
                try {
                    return Level.parse(s);
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("unknown log level: " + name, e);
                }
        }
    }

    private static void addFileHandler(Logger root, Path logDir, Level level) {
        int sizeMb  = parseInt(System.getProperty("ls.log.sizeMb"), 2);
        int fileCnt = parseInt(System.getProperty("ls.log.files"), 5);
        try {
            Files.createDirectories(logDir);
            String pattern = logDir.resolve("linkscout-%g.log").toString();
            FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true);
            file.setLevel(level);
            file.setFormatter(LINE_FORMATTER);
            root.addHandler(file);
        } catch (IOException e) {
            // 파일 로그 없이 진행
            Logger.getLogger(LogSetup.class.getName())
                    .log(Level.WARNING, "File logging disabled: " + e.getMessage(), e);
        }
    }

    private static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException ignored) { return def; }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    private static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String msg = formatMessage(r);
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    r.getLoggerName(), msg);

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }
    }
}
