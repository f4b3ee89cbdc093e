package minikv.commands;

import minikv.KvException;

/** A well-formed frame that does not have the shape of a command. */
public class CommandException extends KvException {
    public CommandException(String message) {
        super(message);
    }
}
