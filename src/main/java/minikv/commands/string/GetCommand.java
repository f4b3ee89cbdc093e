package minikv.commands.string;

import minikv.commands.ArgumentException;
import minikv.commands.Command;
import minikv.db.KeyValueStore;
import minikv.protocol.Resp;

import java.util.List;

public class GetCommand implements Command {
    @Override
    public byte[] execute(KeyValueStore store, List<String> args) throws ArgumentException {
        if (args.size() != 1) {
            throw ArgumentException.wrongArity("GET");
        }
        return Resp.bulkString(store.get(args.get(0)));
    }
}
