package site.tidepool.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import lombok.extern.slf4j.Slf4j;
import site.tidepool.protocol.Resp;

/**
 * 回复编码器，直接编码到输出 ByteBuf。
 */
@Slf4j
public class RespEncoder extends MessageToByteEncoder<Resp> {

    @Override
    protected void encode(final ChannelHandlerContext ctx, final Resp msg, final ByteBuf out) {
        msg.encode(msg, out);
        if (log.isTraceEnabled()) {
            log.trace("编码RESP回复: {} ({} bytes)", msg.getClass().getSimpleName(), out.readableBytes());
        }
    }
}
