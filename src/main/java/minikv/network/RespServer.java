package minikv.network;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import minikv.Config;
import minikv.db.KeyValueStore;
import minikv.protocol.netty.NettyRespDecoder;
import minikv.protocol.netty.NettyRespEncoder;
import minikv.server.ServerStats;
import minikv.utils.Log;

import java.net.InetSocketAddress;

/**
 * Accepts TCP connections and gives each its own pipeline bound to the shared store.
 */
public class RespServer {
    private final Config config;
    private final KeyValueStore store;
    private final ServerStats stats;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public RespServer(Config config, KeyValueStore store, ServerStats stats) {
        this.config = config;
        this.store = store;
        this.stats = stats;
    }

    public RespServer(Config config, KeyValueStore store) {
        this(config, store, new ServerStats());
    }

    /** Binds and starts accepting. Returns once the socket is bound. */
    public synchronized void start() throws InterruptedException {
        if (serverChannel != null) throw new IllegalStateException("server already started");

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        try {
            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
             .channel(NioServerSocketChannel.class)
             .handler(new AcceptFailureLogger())
             .childOption(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(config.readBufferSize))
             .childHandler(new ChannelInitializer<SocketChannel>() {
                 @Override
                 public void initChannel(SocketChannel ch) {
                     ch.pipeline().addLast(new NettyRespDecoder());
                     ch.pipeline().addLast(new NettyRespEncoder());
                     ch.pipeline().addLast(new ClientHandler(store, stats));
                 }
             });

            ChannelFuture f = b.bind(config.host, config.port).sync();
            serverChannel = f.channel();
            Log.info("Listening on " + config.host + ":" + port());
        } catch (InterruptedException | RuntimeException e) {
            shutdownGroups();
            throw e;
        }
    }

    /** The bound port, which differs from the configured one when that was 0. */
    public int port() {
        if (serverChannel == null) throw new IllegalStateException("server not started");
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public ChannelFuture closeFuture() {
        if (serverChannel == null) throw new IllegalStateException("server not started");
        return serverChannel.closeFuture();
    }

    public synchronized void stop() {
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
            serverChannel = null;
        }
        shutdownGroups();
    }

    public ServerStats getStats() {
        return stats;
    }

    private void shutdownGroups() {
        if (bossGroup != null) bossGroup.shutdownGracefully();
        if (workerGroup != null) workerGroup.shutdownGracefully();
        bossGroup = null;
        workerGroup = null;
    }

    /** Sits ahead of the acceptor; failed accepts are logged and the loop carries on. */
    private static class AcceptFailureLogger extends ChannelInboundHandlerAdapter {
        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            Log.warn("Accept failed: " + cause);
        }
    }
}
