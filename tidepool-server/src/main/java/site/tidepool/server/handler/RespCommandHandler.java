package site.tidepool.server.handler;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import lombok.extern.slf4j.Slf4j;
import site.tidepool.blocking.BlockingCoordinator;
import site.tidepool.protocol.Resp;
import site.tidepool.protocol.RespArray;
import site.tidepool.protocol.RespProtocolException;
import site.tidepool.server.command.CommandDispatcher;
import site.tidepool.server.session.ClientSession;

import java.io.IOException;

/**
 * 命令处理器，把解码后的请求交给连接的 {@link ClientSession}。
 *
 * <p>每个连接一个实例，添加到管道时绑定命令执行线程，
 * 所以这里的回调全部在命令执行线程上运行。
 *
 * @author tidepool
 * @since 1.0
 */
@Slf4j
public class RespCommandHandler extends SimpleChannelInboundHandler<Resp> {

    private final CommandDispatcher dispatcher;

    private final BlockingCoordinator coordinator;

    private ClientSession session;

    public RespCommandHandler(final CommandDispatcher dispatcher, final BlockingCoordinator coordinator) {
        this.dispatcher = dispatcher;
        this.coordinator = coordinator;
    }

    @Override
    public void channelActive(final ChannelHandlerContext ctx) throws Exception {
        session = new ClientSession(ctx, dispatcher, coordinator);
        log.debug("客户端连接: {}", ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    /**
     * 处理客户端请求。
     *
     * @param ctx 通道上下文
     * @param msg 解码器输出的请求数组
     */
    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final Resp msg) {
        if (msg instanceof RespArray) {
            session.receive((RespArray) msg);
        } else {
            log.warn("忽略非数组请求: {}", msg.getClass().getSimpleName());
        }
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        if (session != null) {
            session.disconnect();
        }
        log.debug("客户端断开: {}", ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }

    /**
     * 处理连接异常。协议错误回复错误后关闭连接，其他异常直接关闭。
     *
     * @param ctx 通道上下文
     * @param cause 异常原因
     */
    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        if (cause instanceof DecoderException && cause.getCause() instanceof RespProtocolException) {
            log.warn("客户端 {} 协议错误: {}", ctx.channel().remoteAddress(), cause.getCause().getMessage());
            if (session != null) {
                session.protocolError(cause.getCause().getMessage());
            } else {
                ctx.close();
            }
            return;
        }
        if (cause instanceof IOException) {
            log.debug("连接 {} IO异常: {}", ctx.channel().remoteAddress(), cause.getMessage());
        } else {
            log.error("连接异常: {}", cause.getMessage(), cause);
        }
        ctx.close();
    }
}
