package minikv.commands;

import java.util.Collections;
import java.util.List;

/**
 * A command name and its arguments, as sent by the client. The name keeps the
 * client's spelling; matching is case-insensitive.
 */
public final class CommandLine {
    private final String name;
    private final List<String> args;

    public CommandLine(String name, List<String> args) {
        this.name = name;
        this.args = Collections.unmodifiableList(args);
    }

    public String getName() {
        return name;
    }

    public List<String> getArgs() {
        return args;
    }

    @Override
    public String toString() {
        return name + " " + args;
    }
}
