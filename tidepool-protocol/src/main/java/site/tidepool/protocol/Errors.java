package site.tidepool.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 错误回复。内容包含错误类别前缀，例如 "ERR syntax error"、"WRONGTYPE ..."。
 *
 * <p>错误行里不能出现换行，内容中的 \r 和 \n 替换成空格。
 */
@Getter
public class Errors extends Resp {

    private final String content;

    public Errors(final String content) {
        this.content = content.replace('\r', ' ').replace('\n', ' ');
    }

    @Override
    public void encode(final Resp resp, final ByteBuf byteBuf) {
        byteBuf.writeByte('-');
        byteBuf.writeBytes(((Errors) resp).getContent().getBytes(StandardCharsets.UTF_8));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return content;
    }
}
