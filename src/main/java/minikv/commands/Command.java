package minikv.commands;

import minikv.db.KeyValueStore;

import java.util.List;

public interface Command {
    /**
     * Runs the command and returns the encoded reply.
     *
     * @param args arguments after the command name
     */
    byte[] execute(KeyValueStore store, List<String> args) throws ArgumentException;
}
