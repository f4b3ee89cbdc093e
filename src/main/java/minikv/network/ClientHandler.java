package minikv.network;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.DecoderException;
import minikv.KvException;
import minikv.commands.CommandExecutor;
import minikv.commands.CommandExtractor;
import minikv.commands.CommandLine;
import minikv.db.KeyValueStore;
import minikv.protocol.ProtocolException;
import minikv.protocol.Resp;
import minikv.protocol.RespValue;
import minikv.server.ServerStats;
import minikv.utils.Log;

import java.io.IOException;

/**
 * One per connection. Receives decoded frames in arrival order, runs each as a command
 * and writes its reply. Any failure gets a single {@code -ERR} reply and closes this
 * connection only; the store and the other connections carry on.
 */
public class ClientHandler extends ChannelInboundHandlerAdapter {
    private final KeyValueStore store;
    private final ServerStats stats;
    private String remoteAddress = "0.0.0.0:0";
    private boolean closing;

    public ClientHandler(KeyValueStore store, ServerStats stats) {
        this.store = store;
        this.stats = stats;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        if (ctx.channel().remoteAddress() != null) {
            remoteAddress = ctx.channel().remoteAddress().toString();
        }
        stats.connectionOpened();
        Log.debug(() -> "Client connected: " + remoteAddress);
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        stats.connectionClosed();
        Log.debug(() -> "Client disconnected: " + remoteAddress);
        super.channelInactive(ctx);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (!(msg instanceof RespValue)) {
            ctx.fireChannelRead(msg);
            return;
        }
        // Frames already decoded behind a rejected one are dropped.
        if (closing || !ctx.channel().isActive()) return;

        byte[] reply;
        try {
            CommandLine line = CommandExtractor.toCommand((RespValue) msg);
            stats.commandProcessed();
            reply = CommandExecutor.execute(line, store);
        } catch (KvException e) {
            rejectAndClose(ctx, e.getMessage());
            return;
        } catch (RuntimeException e) {
            Log.error("Command failed for " + remoteAddress, e);
            rejectAndClose(ctx, describe(e));
            return;
        }
        ctx.writeAndFlush(reply);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        Throwable root = cause instanceof DecoderException && cause.getCause() != null ? cause.getCause() : cause;
        if (root instanceof ProtocolException) {
            rejectAndClose(ctx, root.getMessage());
        } else if (root instanceof IOException) {
            Log.debug(() -> "Connection " + remoteAddress + " dropped: " + root.getMessage());
            ctx.close();
        } else {
            Log.error("Unexpected error on " + remoteAddress, root);
            ctx.close();
        }
    }

    private void rejectAndClose(ChannelHandlerContext ctx, String message) {
        if (closing || !ctx.channel().isActive()) return;
        closing = true;
        stats.frameRejected();
        Log.warn("Closing " + remoteAddress + ": " + message);
        ctx.writeAndFlush(Resp.error("ERR " + message)).addListener(ChannelFutureListener.CLOSE);
    }

    /** Exception message for the error reply, or the class name when there is none. */
    static String describe(Throwable e) {
        String message = e.getMessage();
        return message != null && !message.isEmpty() ? message : e.getClass().getSimpleName();
    }
}
