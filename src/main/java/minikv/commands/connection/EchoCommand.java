package minikv.commands.connection;

import minikv.commands.ArgumentException;
import minikv.commands.Command;
import minikv.db.KeyValueStore;
import minikv.protocol.Resp;

import java.util.List;

/**
 * ECHO message [message ...]. Multiple messages are joined with no separator and
 * returned as a simple string.
 */
public class EchoCommand implements Command {
    @Override
    public byte[] execute(KeyValueStore store, List<String> args) throws ArgumentException {
        if (args.isEmpty()) {
            throw ArgumentException.wrongArity("ECHO");
        }
        StringBuilder sb = new StringBuilder();
        for (String arg : args) {
            sb.append(arg);
        }
        return Resp.simpleString(sb.toString());
    }
}
