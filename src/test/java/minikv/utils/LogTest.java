package minikv.utils;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.junit.jupiter.api.Assertions.*;

public class LogTest {

    private final Log.LineFormatter formatter = new Log.LineFormatter();

    @Test
    public void testLevelLabels() {
        assertEquals("ERROR", Log.LineFormatter.label(Level.SEVERE));
        assertEquals("WARN", Log.LineFormatter.label(Level.WARNING));
        assertEquals("INFO", Log.LineFormatter.label(Level.INFO));
        assertEquals("DEBUG", Log.LineFormatter.label(Level.FINE));
    }

    @Test
    public void testLineCarriesLevelThreadAndMessage() {
        String line = formatter.format(new LogRecord(Level.WARNING, "Closing /127.0.0.1:5000: boom"));
        String thread = Thread.currentThread().getName();
        assertTrue(line.matches("\\d{2}:\\d{2}:\\d{2}\\.\\d{3} \\[WARN\\] \\[.*\\] Closing /127\\.0\\.0\\.1:5000: boom\\R"), line);
        assertTrue(line.contains("[" + thread + "]"), line);
    }

    @Test
    public void testStackTraceFollowsMessage() {
        LogRecord record = new LogRecord(Level.SEVERE, "Command failed");
        record.setThrown(new IllegalStateException("bad state"));
        String text = formatter.format(record);
        assertTrue(text.contains("[ERROR]"), text);
        assertTrue(text.contains("java.lang.IllegalStateException: bad state"), text);
        assertTrue(text.contains("at minikv.utils.LogTest.testStackTraceFollowsMessage"), text);
    }
}
