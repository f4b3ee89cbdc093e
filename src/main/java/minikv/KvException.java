package minikv;

/**
 * Root of the failures a client request can produce. The message is sent back
 * verbatim after the {@code ERR} prefix.
 */
public class KvException extends Exception {
    public KvException(String message) {
        super(message);
    }

    public KvException(String message, Throwable cause) {
        super(message, cause);
    }

    protected KvException(String message, boolean writableStackTrace) {
        super(message, null, false, writableStackTrace);
    }
}
