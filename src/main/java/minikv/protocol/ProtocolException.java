package minikv.protocol;

import minikv.KvException;

/** The bytes on the wire are not a frame of the supported RESP subset. */
public class ProtocolException extends KvException {
    public ProtocolException(String message) {
        super("Protocol error: " + message);
    }
}
