package minikv.commands;

import minikv.protocol.RespValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads a request frame as {@code [name, arg...]}. Every element must be a string.
 */
public final class CommandExtractor {

    private CommandExtractor() { }

    public static CommandLine toCommand(RespValue value) throws CommandException {
        if (value.getType() != RespValue.Type.ARRAY) {
            throw new CommandException("expected an array of strings, got " + value.getType());
        }
        RespValue.Array array = (RespValue.Array) value;
        if (array.size() == 0) {
            throw new CommandException("empty command");
        }

        List<String> texts = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            RespValue element = array.get(i);
            if (!element.isText()) {
                throw new CommandException("command element " + i + " is not a string");
            }
            texts.add(((RespValue.Text) element).getText());
        }
        return new CommandLine(texts.get(0), new ArrayList<>(texts.subList(1, texts.size())));
    }
}
