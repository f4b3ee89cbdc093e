package minikv.server;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** Counters reported by the periodic stats line. */
public class ServerStats {
    private final AtomicInteger activeConnections = new AtomicInteger();
    private final AtomicLong totalConnections = new AtomicLong();
    private final AtomicLong totalCommands = new AtomicLong();
    private final AtomicLong rejectedFrames = new AtomicLong();

    public void connectionOpened() {
        activeConnections.incrementAndGet();
        totalConnections.incrementAndGet();
    }

    public void connectionClosed() {
        activeConnections.decrementAndGet();
    }

    public void commandProcessed() {
        totalCommands.incrementAndGet();
    }

    /** A frame or command shape was rejected and its connection dropped. */
    public void frameRejected() {
        rejectedFrames.incrementAndGet();
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }

    public long getTotalConnections() {
        return totalConnections.get();
    }

    public long getTotalCommands() {
        return totalCommands.get();
    }

    public long getRejectedFrames() {
        return rejectedFrames.get();
    }
}
