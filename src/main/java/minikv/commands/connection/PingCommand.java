package minikv.commands.connection;

import minikv.commands.ArgumentException;
import minikv.commands.Command;
import minikv.db.KeyValueStore;
import minikv.protocol.Resp;

import java.util.List;

public class PingCommand implements Command {
    private static final byte[] PONG = Resp.simpleString("PONG");

    @Override
    public byte[] execute(KeyValueStore store, List<String> args) throws ArgumentException {
        if (!args.isEmpty()) {
            throw ArgumentException.wrongArity("PING");
        }
        return PONG.clone();
    }
}
