package com.krishnamouli.cohort.network.http;

import com.krishnamouli.cohort.config.CohortConfig;
import com.krishnamouli.cohort.config.EngineDefaults;
import com.krishnamouli.cohort.core.ExperimentEngine;
import com.krishnamouli.cohort.monitoring.EngineHealthMonitor;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpServerExpectContinueHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * Netty server for the assignment API. Port 0 binds an ephemeral port;
 * {@link #getPort()} reports the one actually bound.
 */
public class HTTPServer {
    private static final Logger logger = LoggerFactory.getLogger(HTTPServer.class);
    private static final int ACCEPT_BACKLOG = 1024;

    private final CohortConfig config;
    private final ExperimentEngine engine;
    private final EngineHealthMonitor healthMonitor;
    private EventLoopGroup acceptorGroup;
    private EventLoopGroup ioGroup;
    private Channel serverChannel;

    public HTTPServer(CohortConfig config, ExperimentEngine engine, EngineHealthMonitor healthMonitor) {
        this.config = config;
        this.engine = engine;
        this.healthMonitor = healthMonitor;
    }

    public void start() throws InterruptedException {
        acceptorGroup = new NioEventLoopGroup(1);
        ioGroup = new NioEventLoopGroup();

        try {
            ServerBootstrap bootstrap = new ServerBootstrap()
                    .group(acceptorGroup, ioGroup)
                    .channel(NioServerSocketChannel.class)
                    .option(ChannelOption.SO_BACKLOG, ACCEPT_BACKLOG)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ch.pipeline()
                                    .addLast(new HttpServerCodec())
                                    .addLast(new HttpServerExpectContinueHandler())
                                    // Bounds PUT /experiments bodies
                                    .addLast(new HttpObjectAggregator(EngineDefaults.HTTP_MAX_CONTENT_LENGTH))
                                    .addLast(new HTTPApiHandler(engine, healthMonitor));
                        }
                    });

            serverChannel = bootstrap.bind(config.getHttpPort()).sync().channel();
            logger.info("Cohort HTTP API listening on port {} (/assign, /assignments, /conversions, "
                    + "/experiments, /health, /metrics, /stats)", getPort());

        } catch (InterruptedException e) {
            logger.error("Interrupted while binding port {}", config.getHttpPort(), e);
            shutdown();
            throw e;
        }
    }

    /**
     * @return the bound port, or -1 before {@link #start()}
     */
    public int getPort() {
        if (serverChannel == null) {
            return -1;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public void awaitTermination() throws InterruptedException {
        if (serverChannel != null) {
            serverChannel.closeFuture().sync();
        }
    }

    public void shutdown() {
        logger.info("Stopping HTTP API");

        if (serverChannel != null) {
            serverChannel.close().awaitUninterruptibly();
        }
        for (EventLoopGroup group : new EventLoopGroup[] {ioGroup, acceptorGroup}) {
            if (group != null) {
                group.shutdownGracefully().awaitUninterruptibly();
            }
        }

        logger.info("HTTP API stopped");
    }
}
