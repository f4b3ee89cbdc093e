package minikv.commands;

import minikv.db.KeyValueStore;

import java.util.List;

/**
 * Maps a command to its reply. Holds no state; everything mutable lives in the store.
 */
public final class CommandExecutor {

    private CommandExecutor() { }

    public static byte[] execute(String name, List<String> args, KeyValueStore store)
            throws ArgumentException, UnknownCommandException {
        Command command = CommandRegistry.get(name);
        if (command == null) {
            throw new UnknownCommandException(name);
        }
        return command.execute(store, args);
    }

    public static byte[] execute(CommandLine line, KeyValueStore store)
            throws ArgumentException, UnknownCommandException {
        return execute(line.getName(), line.getArgs(), store);
    }
}
