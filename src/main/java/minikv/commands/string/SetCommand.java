package minikv.commands.string;

import minikv.commands.ArgumentException;
import minikv.commands.Command;
import minikv.db.KeyValueStore;
import minikv.protocol.Resp;

import java.util.List;

/**
 * SET key value [PX milliseconds]
 * <p>
 * The TTL applies only when the third token is {@code PX} and a numeric fourth token
 * follows; any other trailing tokens leave the default TTL in place.
 */
public class SetCommand implements Command {
    private static final byte[] OK = Resp.simpleString("OK");

    @Override
    public byte[] execute(KeyValueStore store, List<String> args) throws ArgumentException {
        if (args.size() < 2) {
            throw ArgumentException.wrongArity("SET");
        }

        String key = args.get(0);
        String value = args.get(1);
        Long ttlMillis = null;

        if (args.size() >= 4 && args.get(2).equalsIgnoreCase("PX")) {
            ttlMillis = parseMillis(args.get(3));
        }

        store.set(key, value, ttlMillis);
        return OK.clone();
    }

    private static Long parseMillis(String token) throws ArgumentException {
        long millis;
        try {
            millis = Long.parseLong(token);
        } catch (NumberFormatException e) {
            return null;
        }
        if (millis < 0) {
            throw new ArgumentException("invalid expire time in 'set' command");
        }
        return millis;
    }
}
