package site.tidepool.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.util.List;

/**
 * 数组回复，元素可以是任意回复类型，包括嵌套数组。
 *
 * <p>content 为 null 时编码为空值数组 "*-1\r\n"，BLPOP 超时返回的就是它。
 */
@Getter
public class RespArray extends Resp {

    private static final byte[] NULL_ARRAY_BYTES = "*-1\r\n".getBytes();
    private static final byte[] EMPTY_ARRAY_BYTES = "*0\r\n".getBytes();

    public static final RespArray EMPTY = new RespArray(new Resp[0]);
    public static final RespArray NULL = new RespArray((Resp[]) null);

    private final Resp[] content;

    public RespArray(final Resp[] content) {
        this.content = content;
    }

    public static RespArray valueOf(final Resp[] content) {
        if (content == null) {
            return NULL;
        }
        if (content.length == 0) {
            return EMPTY;
        }
        return new RespArray(content);
    }

    public static RespArray valueOf(final List<? extends Resp> content) {
        return valueOf(content.toArray(new Resp[0]));
    }

    public boolean isNull() {
        return content == null;
    }

    public int size() {
        return content == null ? 0 : content.length;
    }

    @Override
    public void encode(final Resp resp, final ByteBuf byteBuf) {
        final Resp[] arrayContent = ((RespArray) resp).getContent();
        // 1. 空值数组
        if (arrayContent == null) {
            byteBuf.writeBytes(NULL_ARRAY_BYTES);
            return;
        }
        // 2. 空数组
        if (arrayContent.length == 0) {
            byteBuf.writeBytes(EMPTY_ARRAY_BYTES);
            return;
        }
        // 3. 头部，然后逐个编码元素
        byteBuf.writeByte('*');
        writeLongAsBytes(byteBuf, arrayContent.length);
        byteBuf.writeBytes(CRLF);
        for (final Resp element : arrayContent) {
            element.encode(element, byteBuf);
        }
    }
}
