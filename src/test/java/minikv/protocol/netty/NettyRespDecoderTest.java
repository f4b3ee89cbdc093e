package minikv.protocol.netty;

import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderException;
import minikv.protocol.ProtocolException;
import minikv.protocol.RespDecoder;
import minikv.protocol.RespFrames;
import minikv.protocol.RespValue;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class NettyRespDecoderTest {

    private static RespValue command(String... parts) {
        RespValue[] values = new RespValue[parts.length];
        for (int i = 0; i < parts.length; i++) values[i] = RespValue.bulkString(parts[i]);
        return RespValue.array(values);
    }

    @Test
    public void testFragmentedCommand() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());

        channel.writeInbound(Unpooled.wrappedBuffer("*3\r\n$3\r\nSE".getBytes(StandardCharsets.UTF_8)));
        assertNull(channel.readInbound());

        channel.writeInbound(Unpooled.wrappedBuffer("T\r\n$3\r\nkey\r\n$3\r".getBytes(StandardCharsets.UTF_8)));
        assertNull(channel.readInbound());

        channel.writeInbound(Unpooled.wrappedBuffer("\nval\r\n".getBytes(StandardCharsets.UTF_8)));

        Object msg = channel.readInbound();
        assertEquals(command("SET", "key", "val"), msg);
        assertNull(channel.readInbound());
        channel.finish();
    }

    @Test
    public void testByteAtATime() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());
        byte[] frame = RespFrames.command("ECHO", "hello", "world");
        for (int i = 0; i < frame.length - 1; i++) {
            channel.writeInbound(Unpooled.wrappedBuffer(frame, i, 1));
            assertNull(channel.readInbound(), "decoded early at byte " + i);
        }
        channel.writeInbound(Unpooled.wrappedBuffer(frame, frame.length - 1, 1));
        assertEquals(command("ECHO", "hello", "world"), channel.readInbound());
        channel.finish();
    }

    @Test
    public void testSeveralFramesInOneRead() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());
        String wire = "*1\r\n$4\r\nPING\r\n*2\r\n$3\r\nGET\r\n$1\r\nk\r\n*1\r\n$4";
        channel.writeInbound(Unpooled.copiedBuffer(wire, StandardCharsets.UTF_8));

        assertEquals(command("PING"), channel.readInbound());
        assertEquals(command("GET", "k"), channel.readInbound());
        assertNull(channel.readInbound());

        channel.writeInbound(Unpooled.copiedBuffer("\r\nPING\r\n", StandardCharsets.UTF_8));
        assertEquals(command("PING"), channel.readInbound());
        channel.finish();
    }

    @Test
    public void testFrameLargerThanAnySingleRead() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());
        StringBuilder big = new StringBuilder();
        for (int i = 0; i < 100_000; i++) big.append('x');
        byte[] frame = RespFrames.command("SET", "big", big.toString());

        int chunk = 512;
        for (int off = 0; off < frame.length; off += chunk) {
            int len = Math.min(chunk, frame.length - off);
            channel.writeInbound(Unpooled.wrappedBuffer(frame, off, len));
        }
        assertEquals(command("SET", "big", big.toString()), channel.readInbound());
        channel.finish();
    }

    @Test
    public void testMalformedFrameRaisesProtocolError() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());
        DecoderException e = assertThrows(DecoderException.class, () ->
                channel.writeInbound(Unpooled.copiedBuffer("*2\r\n$3\r\nSET\r\n$garbage\r\n", StandardCharsets.UTF_8)));
        assertTrue(e.getCause() instanceof ProtocolException);
        assertNull(channel.readInbound());
        channel.finishAndReleaseAll();
    }

    @Test
    public void testNestedArraysAcrossReads() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());
        byte[] wire = "*3\r\n*2\r\n+a\r\n$1\r\nb\r\n*0\r\n$1\r\nc\r\n".getBytes(StandardCharsets.UTF_8);
        for (int i = 0; i < wire.length - 1; i++) {
            channel.writeInbound(Unpooled.wrappedBuffer(wire, i, 1));
        }
        assertNull(channel.readInbound());
        channel.writeInbound(Unpooled.wrappedBuffer(wire, wire.length - 1, 1));

        RespValue expected = RespValue.array(
                RespValue.array(RespValue.simpleString("a"), RespValue.bulkString("b")),
                RespValue.array(),
                RespValue.bulkString("c"));
        assertEquals(expected, channel.readInbound());
        channel.finish();
    }

    @Test
    public void testNestingLimitAppliesAcrossReads() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());
        for (int i = 0; i < RespDecoder.MAX_NESTING; i++) {
            channel.writeInbound(Unpooled.copiedBuffer("*1\r\n", StandardCharsets.UTF_8));
        }
        DecoderException e = assertThrows(DecoderException.class, () ->
                channel.writeInbound(Unpooled.copiedBuffer("*1\r\n", StandardCharsets.UTF_8)));
        assertTrue(e.getCause() instanceof ProtocolException);
        channel.finishAndReleaseAll();
    }

    @Test
    public void testManyElementsDecodeWithoutReparsing() {
        int args = 200_000;
        String[] parts = new String[args + 1];
        parts[0] = "ECHO";
        for (int i = 1; i <= args; i++) parts[i] = "x";
        byte[] frame = RespFrames.command(parts);

        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());
        // Re-decoding the whole prefix on every 512-byte read takes minutes at this size.
        assertTimeout(Duration.ofSeconds(5), () -> {
            int chunk = 512;
            for (int off = 0; off < frame.length; off += chunk) {
                channel.writeInbound(Unpooled.wrappedBuffer(frame, off, Math.min(chunk, frame.length - off)));
            }
        });

        RespValue.Array decoded = (RespValue.Array) channel.readInbound();
        assertEquals(args + 1, decoded.size());
        assertEquals(RespValue.bulkString("ECHO"), decoded.get(0));
        assertEquals(RespValue.bulkString("x"), decoded.get(args));
        channel.finish();
    }
}
