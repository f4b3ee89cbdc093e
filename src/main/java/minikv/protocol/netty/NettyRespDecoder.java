package minikv.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import minikv.protocol.IncompleteInputException;
import minikv.protocol.ProtocolException;
import minikv.protocol.RespDecoder;
import minikv.protocol.RespValue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Frames the inbound byte stream into {@link RespValue}s.
 * <p>
 * Array elements are consumed from the cumulation as soon as each one is complete and
 * parked on a stack of open arrays, so a frame spanning many reads is never re-parsed
 * from its first byte. Only the element currently being received is retried.
 */
public class NettyRespDecoder extends ByteToMessageDecoder {

    private static final class OpenArray {
        private final int count;
        private final List<RespValue> elements;

        OpenArray(int count) {
            this.count = count;
            // Count is untrusted until the elements actually arrive.
            this.elements = new ArrayList<>(Math.min(count, 16));
        }

        boolean add(RespValue element) {
            elements.add(element);
            return elements.size() == count;
        }
    }

    private final Deque<OpenArray> openArrays = new ArrayDeque<>();

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        while (in.isReadable()) {
            RespValue value;
            try {
                value = next(in);
            } catch (IncompleteInputException e) {
                return; // Wait for more data
            } catch (ProtocolException e) {
                // Nothing after a malformed frame can be trusted.
                openArrays.clear();
                in.skipBytes(in.readableBytes());
                throw e;
            }

            while (value != null) {
                OpenArray parent = openArrays.peek();
                if (parent == null) {
                    out.add(value);
                    break;
                }
                value = parent.add(value) ? RespValue.array(openArrays.pop().elements) : null;
            }
        }
    }

    /**
     * Consumes one complete element, or the header of an array. Returns the element, an
     * empty array, or {@code null} when a non-empty array was opened.
     */
    private RespValue next(ByteBuf in) throws IncompleteInputException, ProtocolException {
        int position = in.readerIndex();
        if (in.getByte(position) != RespDecoder.ARRAY) {
            RespDecoder.Decoded decoded = RespDecoder.decode(in, position);
            in.skipBytes(decoded.getConsumed());
            return decoded.getValue();
        }

        if (openArrays.size() >= RespDecoder.MAX_NESTING) {
            throw new ProtocolException("arrays nested deeper than " + RespDecoder.MAX_NESTING);
        }
        RespDecoder.ArrayHeader header = RespDecoder.decodeArrayHeader(in, position);
        in.skipBytes(header.getConsumed());
        if (header.getCount() == 0) return RespValue.array();
        openArrays.push(new OpenArray(header.getCount()));
        return null;
    }
}
