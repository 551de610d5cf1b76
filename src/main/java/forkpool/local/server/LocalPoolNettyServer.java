package forkpool.local.server;

import forkpool.local.config.PoolConfig;
import forkpool.local.pool.ExecutionPool;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandler;
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
 * HTTP server exposing the monitoring API of the local pool.
 */
public final class LocalPoolNettyServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LocalPoolNettyServer.class);

    private final PoolConfig config;
    private final RouterHandler router;
    private final ExecutionPool<?> pool;

    private volatile boolean running = false;
    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;

    public LocalPoolNettyServer(PoolConfig config, RouterHandler router, ExecutionPool<?> pool) {
        this.config = config;
        this.router = router;
        this.pool = pool;
    }

    /** HTTP pipeline: codec, aggregation, routing */
    ChannelHandler pipelineInitializer() {
        return new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(64 * 1024));
                p.addLast(router);
            }
        };
    }

    public synchronized boolean start() {
        if (running) return true;
        try {
            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup();

            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer());

            serverChannel = b.bind(config.serverHost(), config.serverPort()).syncUninterruptibly().channel();
            running = true;
            log.info("Local pool server started on {}:{}", config.serverHost(), port());

            // periodic summary while there is work in the pool
            long statsMs = config.statsInterval().toMillis();
            workerGroup.next().scheduleAtFixedRate(() -> {
                int runningTasks = pool.runningCount();
                int waitingTasks = pool.waitingCount();
                if (runningTasks > 0 || waitingTasks > 0) {
                    log.info("stats: running={}/{} waiting={}", runningTasks, pool.capacity(), waitingTasks);
                }
            }, statsMs, statsMs, TimeUnit.MILLISECONDS);

            return true;
        } catch (Exception e) {
            log.error("Start error: {}", e.getMessage(), e);
            stop();
            return false;
        }
    }

    public synchronized void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (workerGroup != null) { workerGroup.shutdownGracefully(); workerGroup = null; }
            if (bossGroup != null)   { bossGroup.shutdownGracefully();   bossGroup = null;   }
            if (running) {
                running = false;
                log.info("Local pool server stopped");
            }
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Port the server is bound to; differs from the configured one when that was 0.
     */
    public synchronized int port() {
        if (serverChannel == null) {
            return config.serverPort();
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    @Override
    public void close() {
        stop();
    }
}
