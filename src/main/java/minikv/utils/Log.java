package minikv.utils;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.function.Supplier;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Server-wide logger. Lines look like {@code 12:00:00.123 [WARN] [worker-1] message},
 * followed by the stack trace when one is attached.
 */
public class Log {
    private static final Logger logger = Logger.getLogger("minikv");

    static {
        logger.setUseParentHandlers(false);
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.ALL);
        handler.setFormatter(new LineFormatter());
        logger.addHandler(handler);
        logger.setLevel(Level.INFO);
    }

    static class LineFormatter extends Formatter {
        private static final DateTimeFormatter TIME =
                DateTimeFormatter.ofPattern("HH:mm:ss.SSS").withZone(ZoneId.systemDefault());

        @Override
        public String format(LogRecord record) {
            StringBuilder line = new StringBuilder();
            line.append(TIME.format(Instant.ofEpochMilli(record.getMillis())))
                .append(" [").append(label(record.getLevel())).append("] [")
                .append(Thread.currentThread().getName()).append("] ")
                .append(record.getMessage())
                .append(System.lineSeparator());
            if (record.getThrown() != null) {
                StringWriter trace = new StringWriter();
                record.getThrown().printStackTrace(new PrintWriter(trace));
                line.append(trace);
            }
            return line.toString();
        }

        static String label(Level level) {
            if (level == Level.SEVERE) return "ERROR";
            if (level == Level.WARNING) return "WARN";
            if (level == Level.INFO) return "INFO";
            return "DEBUG";
        }
    }

    public static void info(String msg) {
        logger.info(msg);
    }

    public static void warn(String msg) {
        logger.warning(msg);
    }

    public static void error(String msg, Throwable cause) {
        logger.log(Level.SEVERE, msg, cause);
    }

    /** Per-connection events; the message is only built when debug is on. */
    public static void debug(Supplier<String> msg) {
        logger.fine(msg);
    }

    public static void setDebug(boolean enabled) {
        logger.setLevel(enabled ? Level.FINE : Level.INFO);
    }
}
