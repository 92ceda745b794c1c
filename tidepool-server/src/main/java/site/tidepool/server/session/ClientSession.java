package site.tidepool.server.session;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import lombok.extern.slf4j.Slf4j;
import site.tidepool.blocking.BlockedClient;
import site.tidepool.blocking.BlockingCoordinator;
import site.tidepool.blocking.Waiter;
import site.tidepool.protocol.Errors;
import site.tidepool.protocol.Resp;
import site.tidepool.protocol.RespArray;
import site.tidepool.server.command.CommandDispatcher;

import java.util.ArrayDeque;

/**
 * 一个客户端连接的会话状态
 *
 * <p>会话保证同一连接上的回复顺序和请求顺序一致。连接被 BLPOP 挂起期间，
 * 后续请求先放进待处理队列；等待结束后先写出 BLPOP 的回复，再按到达顺序执行队列里的请求，
 * 直到队列为空或再次被挂起。
 *
 * <p>所有方法都在命令执行线程上调用。
 *
 * @author tidepool
 * @since 1.0
 */
@Slf4j
public class ClientSession implements BlockedClient {

    private final ChannelHandlerContext ctx;

    private final CommandDispatcher dispatcher;

    private final BlockingCoordinator coordinator;

    /** 挂起期间收到的请求 */
    private final ArrayDeque<RespArray> pending = new ArrayDeque<>();

    /** 当前的阻塞等待，没有挂起时为null */
    private Waiter waiter;

    private boolean closeAfterReply;

    private boolean closed;

    public ClientSession(final ChannelHandlerContext ctx,
                         final CommandDispatcher dispatcher,
                         final BlockingCoordinator coordinator) {
        this.ctx = ctx;
        this.dispatcher = dispatcher;
        this.coordinator = coordinator;
    }

    /**
     * 接收一个解码完成的请求。
     *
     * @param request 请求数组
     */
    public void receive(final RespArray request) {
        if (closed) {
            return;
        }
        if (waiter != null || !pending.isEmpty()) {
            pending.addLast(request);
            log.trace("连接 {} 挂起中，请求排队，队列长度={}", ctx.channel().remoteAddress(), pending.size());
            return;
        }
        execute(request);
    }

    /**
     * 进入挂起状态，由 BLPOP 在返回null之前调用。
     *
     * @param waiter 协调器登记的等待者
     */
    public void suspend(final Waiter waiter) {
        this.waiter = waiter;
    }

    /**
     * 下一条回复写出后关闭连接，之后的请求不再执行。
     */
    public void closeAfterReply() {
        this.closeAfterReply = true;
    }

    /**
     * 等待结束，由协调器在推入或超时时调用。
     */
    @Override
    public void wake(final Resp reply) {
        waiter = null;
        if (closed) {
            return;
        }
        write(reply);
        // 排队的请求在单独的任务中执行
        ctx.executor().execute(this::drain);
    }

    /**
     * 回复协议错误并关闭连接。
     *
     * @param detail 错误描述
     */
    public void protocolError(final String detail) {
        if (closed) {
            return;
        }
        closeAfterReply = true;
        write(new Errors("ERR Protocol error: " + detail));
    }

    /**
     * 连接断开，取消等待并丢弃排队的请求。
     */
    public void disconnect() {
        closed = true;
        if (waiter != null) {
            coordinator.cancel(waiter);
            waiter = null;
        }
        pending.clear();
    }

    private void drain() {
        while (!closed && waiter == null && !pending.isEmpty()) {
            execute(pending.pollFirst());
        }
    }

    private void execute(final RespArray request) {
        final Resp reply = dispatcher.dispatch(request, this);
        if (reply != null) {
            write(reply);
        }
    }

    private void write(final Resp reply) {
        if (closeAfterReply) {
            closed = true;
            pending.clear();
            ctx.writeAndFlush(reply).addListener(ChannelFutureListener.CLOSE);
            return;
        }
        ctx.writeAndFlush(reply);
    }
}
