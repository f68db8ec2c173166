package com.messageworks.server;

import java.net.InetSocketAddress;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import com.messageworks.core.config.TransportConfig;
import com.messageworks.core.runloop.Runloop;
import com.messageworks.core.service.MessagingService;
import com.messageworks.server.connection.NettyChannelAdapter;
import com.messageworks.server.handler.MessageInboundHandler;
import com.messageworks.server.message.MessagePipeline;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;

/**
 * 接受其他进程中的子上下文接入的 TCP 服务端。
 * 每个接入的连接通过握手消息声明子上下文名称，随后作为 MessagingService 的一个子通道参与路由。
 */
@Slf4j
public class NettyMessageServer {

    private final TransportConfig config;
    private final MessagingService service;
    private final Runloop runloop;
    private final ConcurrentMap<String, NettyChannelAdapter> attachedChildren = new ConcurrentHashMap<>();
    private final CompletableFuture<Void> shutdownFuture = new CompletableFuture<>();
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    private volatile int boundPort;

    /**
     * @param runloop 入站消息投递到的上下文 Runloop，为 null 时在 Netty IO 线程上处理
     */
    public NettyMessageServer(TransportConfig config, MessagingService service, Runloop runloop) {
        this.config = config;
        this.service = service;
        this.runloop = runloop;
    }

    public CompletableFuture<Void> start() {
        CompletableFuture<Void> startFuture = new CompletableFuture<>();
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();

        ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        MessagePipeline.addCodec(ch.pipeline(), config);
                        ch.pipeline().addLast("messageInboundHandler",
                                new MessageInboundHandler(service, runloop, attachedChildren));
                    }
                })
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true);

        ChannelFuture bindFuture = b.bind(config.getHost(), config.getPort());
        bindFuture.addListener(future -> {
            if (future.isSuccess()) {
                serverChannel = bindFuture.channel();
                boundPort = ((InetSocketAddress) serverChannel.localAddress()).getPort();
                log.info("NettyMessageServer started and listening on {}:{}", config.getHost(), boundPort);
                startFuture.complete(null);
            } else {
                log.error("NettyMessageServer failed to bind {}:{}", config.getHost(), config.getPort(),
                        future.cause());
                startFuture.completeExceptionally(future.cause());
            }
        });
        return startFuture;
    }

    public CompletableFuture<Void> shutdown() {
        log.info("Shutting down NettyMessageServer on port {}", boundPort);
        attachedChildren.values().forEach(NettyChannelAdapter::close);
        if (serverChannel != null) {
            serverChannel.close();
        }

        CompletableFuture<Void> bossShutdown = toCompletable(bossGroup, "BossGroup");
        CompletableFuture<Void> workerShutdown = toCompletable(workerGroup, "WorkerGroup");

        CompletableFuture.allOf(bossShutdown, workerShutdown)
                .thenRun(() -> {
                    log.info("NettyMessageServer on port {} shut down completely.", boundPort);
                    shutdownFuture.complete(null);
                })
                .exceptionally(e -> {
                    log.error("NettyMessageServer shutdown encountered errors on port {}: {}", boundPort,
                            e.getMessage());
                    shutdownFuture.completeExceptionally(e);
                    return null;
                });
        return shutdownFuture;
    }

    public int getBoundPort() {
        return boundPort;
    }

    /**
     * 当前已接入的子上下文名称及其通道。
     */
    public Map<String, NettyChannelAdapter> getAttachedChildren() {
        return Map.copyOf(attachedChildren);
    }

    private static CompletableFuture<Void> toCompletable(EventLoopGroup group, String groupName) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        if (group == null) {
            result.complete(null);
            return result;
        }
        Future<?> future = group.shutdownGracefully();
        future.addListener(f -> {
            if (f.isSuccess()) {
                log.debug("{} shutdown gracefully.", groupName);
                result.complete(null);
            } else {
                log.error("{} shutdown failed.", groupName, f.cause());
                result.completeExceptionally(f.cause());
            }
        });
        return result;
    }
}
