package site.tidepool.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 简单字符串回复，内容不能包含CR或LF。
 */
@Getter
public class SimpleString extends Resp {

    public static final SimpleString OK = new SimpleString("OK");
    public static final SimpleString PONG = new SimpleString("PONG");

    private final String content;

    private final byte[] contentBytes;

    public SimpleString(final String content) {
        this.content = content;
        this.contentBytes = content.getBytes(StandardCharsets.UTF_8);
    }

    public static SimpleString valueOf(final String content) {
        if ("OK".equals(content)) {
            return OK;
        } else if ("PONG".equals(content)) {
            return PONG;
        }
        return new SimpleString(content);
    }

    @Override
    public void encode(final Resp resp, final ByteBuf byteBuf) {
        byteBuf.writeByte('+');
        byteBuf.writeBytes(((SimpleString) resp).contentBytes);
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return content;
    }
}
