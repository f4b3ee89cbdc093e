package minikv;

import minikv.commands.CommandRegistry;
import minikv.db.KeyValueStore;
import minikv.network.RespServer;
import minikv.server.ServerStats;
import minikv.utils.Log;

import java.util.TreeSet;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Process entry point: {@code java -jar minikv.jar [config.yaml]}.
 */
public class MiniKv {

    public static void printBanner(Config config) {
        Log.info("\n" +
                " :: MiniKV ::       (v0.1.0) \n" +
                " :: Protocol ::     RESP (PING ECHO SET GET) \n" +
                " :: Address ::      " + config.host + ":" + config.port + "\n");
    }

    public static void main(String[] args) throws Exception {
        Config config = Config.load(args.length > 0 ? args[0] : Config.DEFAULT_FILE);
        Log.setDebug(config.debug);
        printBanner(config);

        KeyValueStore store = new KeyValueStore();
        ServerStats stats = new ServerStats();
        RespServer server = new RespServer(config, store, stats);
        server.start();
        Log.info("Commands: " + new TreeSet<>(CommandRegistry.names()));

        ScheduledExecutorService monitor = null;
        if (config.statsIntervalSeconds > 0) {
            monitor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "Stats");
                t.setDaemon(true);
                return t;
            });
            final long[] lastCount = { 0 };
            monitor.scheduleAtFixedRate(() -> {
                long current = stats.getTotalCommands();
                long ops = (current - lastCount[0]) / config.statsIntervalSeconds;
                lastCount[0] = current;
                if (ops > 0 || stats.getActiveConnections() > 0) {
                    Log.info(String.format("[STATS] Clients: %d | Keys: %d | Rejected: %d | OPS: %d cmd/s",
                            stats.getActiveConnections(), store.size(), stats.getRejectedFrames(), ops));
                }
            }, config.statsIntervalSeconds, config.statsIntervalSeconds, TimeUnit.SECONDS);
        }

        final ScheduledExecutorService statsMonitor = monitor;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            Log.info("Shutting down...");
            if (statsMonitor != null) statsMonitor.shutdownNow();
            server.stop();
        }));

        server.closeFuture().sync();
    }
}
