package minikv.protocol;

import minikv.KvException;

/**
 * The buffer ended before the frame did. Not a client error: the caller keeps the
 * bytes it has and retries once more arrive.
 */
public class IncompleteInputException extends KvException {
    private final int position;

    public IncompleteInputException(int position) {
        // Thrown on every short read, so skip the stack trace.
        super("incomplete frame, need more bytes after offset " + position, false);
        this.position = position;
    }

    /** Absolute buffer offset at which input ran out. */
    public int getPosition() {
        return position;
    }
}
