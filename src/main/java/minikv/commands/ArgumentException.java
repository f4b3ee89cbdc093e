package minikv.commands;

import minikv.KvException;

/** A known command called with the wrong number or kind of arguments. */
public class ArgumentException extends KvException {
    public ArgumentException(String message) {
        super(message);
    }

    public static ArgumentException wrongArity(String command) {
        return new ArgumentException("wrong number of arguments for '" + command.toLowerCase() + "' command");
    }
}
