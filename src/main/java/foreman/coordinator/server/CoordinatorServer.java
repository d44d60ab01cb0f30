package foreman.coordinator.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Netty HTTP server for the control API.
 */
public final class CoordinatorServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorServer.class);
    private static final int MAX_CONTENT_LENGTH = 1024 * 1024;

    private final RouterHandler router;

    private volatile boolean running = false;
    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;

    public CoordinatorServer(RouterHandler router) {
        this.router = router;
    }

    /**
     * Bind and start serving.
     *
     * @param port 0 picks an ephemeral port
     * @return the bound port
     */
    public synchronized int start(String host, int port) {
        if (running) {
            throw new IllegalStateException("Server already running on port " + port());
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        try {
            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ChannelPipeline p = ch.pipeline();
                            p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                            p.addLast(new HttpServerCodec());
                            p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                            p.addLast(router);
                        }
                    });

            serverChannel = b.bind(host, port).syncUninterruptibly().channel();
            running = true;
            log.info("Coordinator server listening on {}:{}", host, port());
            return port();
        } catch (RuntimeException e) {
            log.error("Failed to start server on {}:{}", host, port, e);
            shutdownGroups();
            throw e;
        }
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        try {
            serverChannel.close().syncUninterruptibly();
            serverChannel = null;
        } finally {
            shutdownGroups();
            running = false;
            log.info("Coordinator server stopped");
        }
    }

    public synchronized int port() {
        return serverChannel == null ? -1 : ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void close() {
        stop();
    }

    private void shutdownGroups() {
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
            bossGroup = null;
        }
    }
}
