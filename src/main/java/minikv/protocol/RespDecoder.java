package minikv.protocol;

import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes one RESP frame from a buffer. Reads with absolute indices only, so the
 * buffer's reader and writer indices are never moved; the caller advances by
 * {@link Decoded#getConsumed()} once a frame is complete.
 *
 * <pre>
 *   +text\r\n                 simple string
 *   $len\r\npayload\r\n       bulk string, len of any digit count
 *   *count\r\nelement...      array of count elements
 * </pre>
 */
public final class RespDecoder {

    public static final byte SIMPLE_STRING = '+';
    public static final byte BULK_STRING = '$';
    public static final byte ARRAY = '*';

    /** Same ceiling Redis puts on a single bulk payload. */
    public static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;
    public static final int MAX_NESTING = 32;

    private static final byte CR = '\r';
    private static final byte LF = '\n';

    public static final class Decoded {
        private final RespValue value;
        private final int consumed;

        Decoded(RespValue value, int consumed) {
            this.value = value;
            this.consumed = consumed;
        }

        public RespValue getValue() {
            return value;
        }

        /** Number of bytes the frame occupies, terminators included. */
        public int getConsumed() {
            return consumed;
        }
    }

    /** The {@code *count\r\n} line that opens an array, without its elements. */
    public static final class ArrayHeader {
        private final int count;
        private final int consumed;

        ArrayHeader(int count, int consumed) {
            this.count = count;
            this.consumed = consumed;
        }

        public int getCount() {
            return count;
        }

        public int getConsumed() {
            return consumed;
        }
    }

    private RespDecoder() { }

    /**
     * Decodes the frame starting at {@code position}; bytes up to the buffer's
     * writer index are considered available.
     *
     * @throws IncompleteInputException the frame is valid so far but not complete
     * @throws ProtocolException        a byte falls outside the grammar
     */
    public static Decoded decode(ByteBuf buffer, int position) throws IncompleteInputException, ProtocolException {
        return decodeAt(buffer, position, buffer.writerIndex(), 0);
    }

    /**
     * Decodes only the header line of the array starting at {@code position}, for callers
     * that collect the elements themselves as they arrive.
     *
     * @throws IncompleteInputException the header line is not complete yet
     * @throws ProtocolException        the byte at {@code position} is not {@code '*'} or the count is malformed
     */
    public static ArrayHeader decodeArrayHeader(ByteBuf buffer, int position)
            throws IncompleteInputException, ProtocolException {
        int end = buffer.writerIndex();
        if (position >= end) throw new IncompleteInputException(position);
        byte type = buffer.getByte(position);
        if (type != ARRAY) {
            throw new ProtocolException("expected '*' but got '" + printable(type) + "' at offset " + position);
        }
        long[] header = readLength(buffer, position + 1, end);
        return new ArrayHeader((int) header[0], (int) header[1] - position);
    }

    private static Decoded decodeAt(ByteBuf buf, int pos, int end, int depth)
            throws IncompleteInputException, ProtocolException {
        if (pos >= end) throw new IncompleteInputException(pos);

        byte type = buf.getByte(pos);
        switch (type) {
            case SIMPLE_STRING:
                return decodeSimpleString(buf, pos, end);
            case BULK_STRING:
                return decodeBulkString(buf, pos, end);
            case ARRAY:
                return decodeArray(buf, pos, end, depth);
            default:
                throw new ProtocolException("unexpected type byte '" + printable(type) + "' at offset " + pos);
        }
    }

    private static Decoded decodeSimpleString(ByteBuf buf, int pos, int end)
            throws IncompleteInputException, ProtocolException {
        int start = pos + 1;
        for (int i = start; i < end; i++) {
            byte b = buf.getByte(i);
            if (b == CR) {
                expectLf(buf, i + 1, end);
                String text = buf.toString(start, i - start, StandardCharsets.UTF_8);
                return new Decoded(RespValue.simpleString(text), i + 2 - pos);
            }
            if (b == LF) throw new ProtocolException("bare LF in simple string at offset " + i);
        }
        throw new IncompleteInputException(end);
    }

    private static Decoded decodeBulkString(ByteBuf buf, int pos, int end)
            throws IncompleteInputException, ProtocolException {
        long[] header = readLength(buf, pos + 1, end);
        int length = (int) header[0];
        int payloadStart = (int) header[1];
        if (length > MAX_BULK_LENGTH) throw new ProtocolException("invalid bulk length " + length);

        int payloadEnd = payloadStart + length;
        if (payloadEnd < payloadStart || payloadEnd >= end) throw new IncompleteInputException(end);
        if (buf.getByte(payloadEnd) != CR) {
            throw new ProtocolException("bulk payload not terminated by CRLF at offset " + payloadEnd);
        }
        expectLf(buf, payloadEnd + 1, end);

        String text = buf.toString(payloadStart, length, StandardCharsets.UTF_8);
        return new Decoded(RespValue.bulkString(text), payloadEnd + 2 - pos);
    }

    private static Decoded decodeArray(ByteBuf buf, int pos, int end, int depth)
            throws IncompleteInputException, ProtocolException {
        if (depth >= MAX_NESTING) throw new ProtocolException("arrays nested deeper than " + MAX_NESTING);

        ArrayHeader header = decodeArrayHeader(buf, pos);
        int count = header.getCount();
        int cursor = pos + header.getConsumed();

        // Count is untrusted until the elements actually arrive.
        List<RespValue> elements = new ArrayList<>(Math.min(count, 16));
        for (int i = 0; i < count; i++) {
            Decoded element = decodeAt(buf, cursor, end, depth + 1);
            elements.add(element.getValue());
            cursor += element.getConsumed();
        }
        return new Decoded(RespValue.array(elements), cursor - pos);
    }

    /**
     * Reads a non-negative decimal terminated by CRLF, one digit at a time.
     * Returns {value, offset just past the CRLF}.
     */
    private static long[] readLength(ByteBuf buf, int start, int end)
            throws IncompleteInputException, ProtocolException {
        long value = 0;
        int i = start;
        for (; i < end; i++) {
            byte b = buf.getByte(i);
            if (b == CR) break;
            if (b < '0' || b > '9') {
                throw new ProtocolException("invalid length byte '" + printable(b) + "' at offset " + i);
            }
            value = value * 10 + (b - '0');
            if (value > Integer.MAX_VALUE) throw new ProtocolException("length out of range at offset " + start);
        }
        if (i >= end) throw new IncompleteInputException(end);
        if (i == start) throw new ProtocolException("empty length at offset " + start);
        expectLf(buf, i + 1, end);
        return new long[] { value, i + 2 };
    }

    private static void expectLf(ByteBuf buf, int index, int end) throws IncompleteInputException, ProtocolException {
        if (index >= end) throw new IncompleteInputException(end);
        if (buf.getByte(index) != LF) throw new ProtocolException("expected LF after CR at offset " + index);
    }

    private static String printable(byte b) {
        if (b >= 0x20 && b < 0x7f) return String.valueOf((char) b);
        return String.format("\\x%02x", b & 0xff);
    }
}
