package minikv.commands;

import minikv.commands.connection.EchoCommand;
import minikv.commands.connection.PingCommand;
import minikv.commands.string.GetCommand;
import minikv.commands.string.SetCommand;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public class CommandRegistry {
    private static final Map<String, Command> commands = new HashMap<>();

    static {
        // Connection
        register("PING", new PingCommand());
        register("ECHO", new EchoCommand());

        // String
        register("SET", new SetCommand());
        register("GET", new GetCommand());
    }

    private static void register(String name, Command command) {
        commands.put(name, command);
    }

    /** Case-insensitive lookup; {@code null} when the name is not registered. */
    public static Command get(String name) {
        return commands.get(name.toUpperCase(Locale.ROOT));
    }

    public static Set<String> names() {
        return commands.keySet();
    }
}
