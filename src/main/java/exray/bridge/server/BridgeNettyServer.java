package exray.bridge.server;

import exray.bridge.config.BridgeConfig;
import exray.bridge.config.Dependencies;
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
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * HTTP server for the bridge API.
 *
 * Controllers call the workflow engine and the artifact store synchronously, so the
 * router runs on a separate executor group instead of the I/O event loop.
 */
public final class BridgeNettyServer {

    private static final Logger log = LoggerFactory.getLogger(BridgeNettyServer.class);

    /** Uploads are aggregated in memory before being spooled to temp files. */
    static final int MAX_CONTENT_LENGTH = 256 * 1024 * 1024;

    private static volatile boolean running = false;
    private static Channel serverChannel;
    private static EventLoopGroup bossGroup;
    private static EventLoopGroup workerGroup;
    private static EventExecutorGroup handlerGroup;
    private static Dependencies dependencies;
    private static boolean ownsDependencies;

    private BridgeNettyServer() {
    }

    public static ChannelHandler pipelineInitializer(RouterHandler router, EventExecutorGroup executors) {
        return new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new IdleStateHandler(120, 0, 0, TimeUnit.SECONDS));
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                p.addLast(executors, "router", router);
            }
        };
    }

    /**
     * Start with dependencies built from the config. They are closed on {@link #stop()}.
     */
    public static synchronized boolean start(int port, BridgeConfig config) {
        if (running) {
            return true;
        }
        Dependencies deps = Dependencies.create(config);
        boolean started = start(port, deps);
        if (started) {
            ownsDependencies = true;
        } else {
            deps.close();
        }
        return started;
    }

    /**
     * Start with caller-owned dependencies.
     */
    public static synchronized boolean start(int port, Dependencies deps) {
        if (running) {
            return true;
        }
        try {
            dependencies = deps;
            ownsDependencies = false;
            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup();
            handlerGroup = new DefaultEventExecutorGroup(deps.config().workerThreads());

            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer(deps.routerHandler(), handlerGroup));

            serverChannel = b.bind(deps.config().serverHost(), port).syncUninterruptibly().channel();
            running = true;
            log.info("Bridge started on {}:{}", deps.config().serverHost(), port);
            return true;
        } catch (Throwable t) {
            log.error("Start error: {}", t.getMessage(), t);
            release();
            return false;
        }
    }

    public static synchronized void stop() {
        if (!running) {
            return;
        }
        release();
        log.info("Bridge stopped");
    }

    private static void release() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (handlerGroup != null) {
                handlerGroup.shutdownGracefully();
                handlerGroup = null;
            }
            if (workerGroup != null) {
                workerGroup.shutdownGracefully();
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully();
                bossGroup = null;
            }
            if (ownsDependencies && dependencies != null) {
                dependencies.close();
            }
            dependencies = null;
            ownsDependencies = false;
            running = false;
        }
    }

    public static boolean isRunning() {
        return running;
    }
}
