package minikv.commands;

import minikv.KvException;

public class UnknownCommandException extends KvException {
    private final String command;

    public UnknownCommandException(String command) {
        super("unknown command '" + command + "'");
        this.command = command;
    }

    public String getCommand() {
        return command;
    }
}
