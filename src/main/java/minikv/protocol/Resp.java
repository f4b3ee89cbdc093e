package minikv.protocol;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Reply serialization. Every method returns a complete, CRLF-terminated frame.
 */
public class Resp {
    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NULL_BULK = "$-1\r\n".getBytes(StandardCharsets.UTF_8);

    public static byte[] simpleString(String s) {
        return ("+" + s + "\r\n").getBytes(StandardCharsets.UTF_8);
    }

    public static byte[] error(String s) {
        return ("-" + s + "\r\n").getBytes(StandardCharsets.UTF_8);
    }

    public static byte[] bulkString(String s) {
        if (s == null) return nullBulkString();
        return bulkString(s.getBytes(StandardCharsets.UTF_8));
    }

    public static byte[] bulkString(byte[] b) {
        if (b == null) return nullBulkString();
        ByteArrayOutputStream bos = new ByteArrayOutputStream(b.length + 16);
        bos.writeBytes(("$" + b.length + "\r\n").getBytes(StandardCharsets.UTF_8));
        bos.writeBytes(b);
        bos.writeBytes(CRLF);
        return bos.toByteArray();
    }

    public static byte[] nullBulkString() {
        return NULL_BULK.clone();
    }
}
