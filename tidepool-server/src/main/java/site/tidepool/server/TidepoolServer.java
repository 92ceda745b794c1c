package site.tidepool.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.kqueue.KQueue;
import io.netty.channel.kqueue.KQueueEventLoopGroup;
import io.netty.channel.kqueue.KQueueServerSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.tidepool.blocking.BlockingCoordinator;
import site.tidepool.core.RedisCore;
import site.tidepool.core.RedisCoreImpl;
import site.tidepool.datastructure.StreamIdAllocator;
import site.tidepool.protocol.Errors;
import site.tidepool.protocol.Resp;
import site.tidepool.protocol.RespArray;
import site.tidepool.protocol.handler.RespDecoder;
import site.tidepool.protocol.handler.RespEncoder;
import site.tidepool.server.command.CommandDispatcher;
import site.tidepool.server.config.RedisServerConfig;
import site.tidepool.server.context.RedisContext;
import site.tidepool.server.context.RedisContextImpl;
import site.tidepool.server.handler.RespCommandHandler;

import java.net.InetSocketAddress;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 基于 Netty 的服务器实现。
 *
 * <p>线程模型：
 * <ul>
 *   <li>boss/worker 事件循环负责网络读写和请求编解码，按操作系统选择 Epoll、KQueue 或 NIO
 *   <li>所有连接的命令处理器绑定到同一个单线程执行器，键空间和阻塞协调器只在这个线程上访问
 *   <li>BLPOP 的超时计时器也调度在这个执行器上，推入和超时按任务先后决定结果
 * </ul>
 *
 * @author tidepool
 * @since 1.0
 */
@Slf4j
public class TidepoolServer implements RedisServer {

    /** 服务器配置 */
    @Getter
    private final RedisServerConfig config;

    /** 服务器Channel类型，根据操作系统自动选择 */
    private Class<? extends ServerChannel> serverChannelClass;

    /** 接收连接的事件循环组 */
    private EventLoopGroup bossGroup;

    /** 处理I/O的事件循环组 */
    private EventLoopGroup workerGroup;

    /** 命令执行线程 */
    @Getter
    private final DefaultEventExecutor commandExecutor;

    /** 服务器Channel */
    private Channel serverChannel;

    @Getter
    private final RedisCore redisCore;

    @Getter
    private final BlockingCoordinator blockingCoordinator;

    @Getter
    private final RedisContext redisContext;

    private final CommandDispatcher dispatcher;

    /** SHUTDOWN 命令触发的动作，默认只停止服务器 */
    private volatile Runnable shutdownAction;

    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public TidepoolServer(final RedisServerConfig config) {
        config.validate();
        this.config = config;

        // 1. 初始化事件循环组和命令执行线程
        initializeEventLoopGroups();
        this.commandExecutor = new DefaultEventExecutor(new DefaultThreadFactory("tidepool-cmd"));

        // 2. 初始化键空间和阻塞协调器
        this.redisCore = new RedisCoreImpl();
        this.blockingCoordinator = new BlockingCoordinator(commandExecutor);

        // 3. 创建上下文和分发器
        this.shutdownAction = () -> new Thread(this::stop, "tidepool-shutdown").start();
        this.redisContext = new RedisContextImpl(redisCore, blockingCoordinator, new StreamIdAllocator(),
                () -> shutdownAction.run());
        this.dispatcher = new CommandDispatcher(redisContext);
    }

    /**
     * 替换 SHUTDOWN 命令的动作。启动器用它退出进程。
     *
     * @param shutdownAction 新的动作，在命令执行线程上调用
     */
    public void setShutdownAction(final Runnable shutdownAction) {
        this.shutdownAction = shutdownAction;
    }

    @Override
    public void start() {
        final ServerBootstrap serverBootstrap = new ServerBootstrap();
        serverBootstrap.group(bossGroup, workerGroup)
                .channel(serverChannelClass)
                .option(ChannelOption.SO_BACKLOG, config.getBacklogSize())
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_RCVBUF, config.getReceiveBufferSize())
                .childOption(ChannelOption.SO_SNDBUF, config.getSendBufferSize())
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        final ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(new RespDecoder(config.getMaxInlineLength(),
                                config.getMaxBulkLength(), config.getMaxArrayLength()));
                        pipeline.addLast(new RespEncoder());
                        pipeline.addLast(commandExecutor, new RespCommandHandler(dispatcher, blockingCoordinator));
                    }
                });
        try {
            serverChannel = serverBootstrap.bind(config.getHost(), config.getPort()).sync().channel();
            log.info("Tidepool server started at {}:{}", config.getHost(), getPort());
        } catch (InterruptedException e) {
            log.error("Tidepool server start interrupted", e);
            stop();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("启动被中断", e);
        } catch (Exception e) {
            log.error("Tidepool server start error: {}", e.getMessage());
            stop();
            throw new IllegalStateException("无法监听 " + config.getHost() + ":" + config.getPort(), e);
        }
    }

    /**
     * 停止服务器。
     *
     * <p>按以下顺序关闭：服务器Channel、worker线程组、boss线程组、命令执行线程。
     */
    @Override
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        try {
            if (serverChannel != null) {
                serverChannel.close().sync();
            }
            if (workerGroup != null) {
                workerGroup.shutdownGracefully().sync();
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully().sync();
            }
            commandExecutor.shutdownGracefully();
            log.info("Tidepool server stopped");
        } catch (InterruptedException e) {
            log.error("Tidepool server stop error", e);
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public int getPort() {
        if (serverChannel == null) {
            return config.getPort();
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    /**
     * 在命令执行线程上执行命令。从命令执行线程内部调用时直接执行。
     *
     * @param command RESP格式的请求数组
     * @return 命令执行结果，阻塞命令在没有数据时回复 nil 数组
     */
    @Override
    public Resp executeCommand(final Resp command) {
        if (!(command instanceof RespArray)) {
            return new Errors("ERR Invalid command format");
        }
        final RespArray request = (RespArray) command;
        if (commandExecutor.inEventLoop()) {
            return dispatcher.dispatch(request, null);
        }
        try {
            return commandExecutor.submit(() -> dispatcher.dispatch(request, null)).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new Errors("ERR interrupted");
        } catch (ExecutionException e) {
            log.error("执行命令失败", e.getCause());
            return new Errors("ERR " + e.getCause().getMessage());
        }
    }

    private void initializeEventLoopGroups() {
        final String osName = System.getProperty("os.name").toLowerCase();

        if (Epoll.isAvailable()) {
            log.info("使用Epoll EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new EpollEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("epoll-boss"));
            this.workerGroup = new EpollEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("epoll-worker"));
            this.serverChannelClass = EpollServerSocketChannel.class;
        } else if (KQueue.isAvailable()) {
            log.info("使用KQueue EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new KQueueEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("kqueue-boss"));
            this.workerGroup = new KQueueEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("kqueue-worker"));
            this.serverChannelClass = KQueueServerSocketChannel.class;
        } else {
            log.info("使用NIO EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new NioEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("nio-boss"));
            this.workerGroup = new NioEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("nio-worker"));
            this.serverChannelClass = NioServerSocketChannel.class;
        }
    }
}
