package ember;

import ember.network.ClientHandler;
import ember.protocol.netty.NettyFrameDecoder;
import ember.protocol.netty.NettyFrameEncoder;
import ember.utils.Log;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Accept loop plus per-connection pipelines, all sharing one
 * {@link ServerContext}.
 */
public class EmberServer {
    private final String bindAddress;
    private final int port;
    private final ServerContext context;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;
    private volatile boolean stopped = false;

    public EmberServer(String bindAddress, int port, ServerContext context) {
        this.bindAddress = bindAddress;
        this.port = port;
        this.context = context;
    }

    /**
     * Binds the listening socket.
     *
     * @return the bound port, useful when {@code port} was 0
     * @throws InterruptedException if interrupted while binding
     * @throws Exception the bind failure, e.g. a {@code java.net.BindException}
     */
    public synchronized int start() throws Exception {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        try {
            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
             .channel(NioServerSocketChannel.class)
             .childOption(ChannelOption.TCP_NODELAY, true)
             .childHandler(new ChannelInitializer<SocketChannel>() {
                 @Override
                 public void initChannel(SocketChannel ch) throws Exception {
                     ch.pipeline().addLast(new NettyFrameDecoder());
                     ch.pipeline().addLast(new NettyFrameEncoder());
                     ch.pipeline().addLast(new ClientHandler(context));
                 }
             });

            serverChannel = b.bind(bindAddress, port).sync().channel();
        } catch (Exception e) {
            bossGroup.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
            workerGroup.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
            throw e;
        }
        int boundPort = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        Log.info("Ready on " + bindAddress + ":" + boundPort);
        return boundPort;
    }

    /** Blocks until the listening socket is closed. */
    public void awaitTermination() throws InterruptedException {
        serverChannel.closeFuture().sync();
    }

    /**
     * Stops accepting, lets in-flight requests finish, then closes the
     * keyspace (which waits for its janitor to exit).
     */
    public synchronized void stop() {
        if (stopped) return;
        stopped = true;
        Log.info("Shutting down...");
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(100, 5000, TimeUnit.MILLISECONDS).syncUninterruptibly();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(100, 5000, TimeUnit.MILLISECONDS).syncUninterruptibly();
        }
        context.getKeyspace().close();
        Log.info("Shutdown complete");
    }

    public ServerContext getContext() {
        return context;
    }
}
