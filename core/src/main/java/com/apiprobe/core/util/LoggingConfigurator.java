package com.apiprobe.core.util;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * JUL 루트 재구성. slf4j-jdk14 바인딩을 쓰므로 SLF4J 로그와 StructuredLog 가 같은 핸들러로 간다.
 *
 * 시스템 프로퍼티:
 *  -Dap.log.level=INFO|FINE|WARNING ...
 *  -Dap.log.sizeMb=5     (파일 1개 최대 크기)
 *  -Dap.log.files=3      (롤링 개수)
 *  -Dap.log.console=true (콘솔 출력 여부)
 */
public final class LoggingConfigurator {
    private LoggingConfigurator() {}

    public static final String FILE_PATTERN = "app-%g.log";

    /** 시스템 프로퍼티 기반 초기화 */
    public static void init(Path logDir) {
        Level level = parseLevel(System.getProperty("ap.log.level"), Level.INFO);
        init(logDir, level);
    }

    public static void init(Path logDir, Level rootLevel) {
        int sizeMb = intProp("ap.log.sizeMb", 5);
        int files = intProp("ap.log.files", 3);
        boolean console = Boolean.parseBoolean(System.getProperty("ap.log.console", "true"));
        init(logDir, rootLevel, sizeMb * 1024 * 1024, files, console);
    }

    public static void init(Path logDir, Level rootLevel, int maxBytes, int fileCount, boolean console) {
        Logger root = LogManager.getLogManager().getLogger("");
        for (Handler h : root.getHandlers()) {
            root.removeHandler(h);
            h.close();
        }

        Formatter fmt = new LineFormatter();
        if (console) {
            ConsoleHandler ch = new ConsoleHandler();
            ch.setLevel(rootLevel);
            ch.setFormatter(fmt);
            root.addHandler(ch);
        }

        if (logDir != null) {
            try {
                Files.createDirectories(logDir);
                String pattern = Paths.get(logDir.toString(), FILE_PATTERN).toString();
                FileHandler file = new FileHandler(pattern, Math.max(1024, maxBytes), Math.max(1, fileCount), true);
                file.setLevel(rootLevel);
                file.setFormatter(fmt); // 같은 포맷
                root.addHandler(file);
            } catch (IOException e) {
                System.err.println("Failed to init file handler: " + e.getMessage());
            }
        }

        root.setLevel(rootLevel);
    }

    static Level parseLevel(String s, Level def) {
        if (s == null || s.isBlank()) return def;
        try {
            return Level.parse(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return def;
        }
    }

    private static int intProp(String key, int def) {
        String v = System.getProperty(key);
        if (v == null || v.isBlank()) return def;
        try {
            return Math.max(1, Integer.parseInt(v.trim()));
        } catch (NumberFormatException e) {
            return def;
        }
    }

    /**
     * 한 줄 포맷 + 스레드명 + 예외 스택.
     * StructuredLog 의 JSON 라인은 앞머리 없이 그대로 둔다.
     */
    static final class LineFormatter extends Formatter {
        @Override
        public String format(LogRecord r) {
            String msg = formatMessage(r);
            String base = msg.startsWith("{")
                    ? msg + System.lineSeparator()
                    : String.format(Locale.ROOT,
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
