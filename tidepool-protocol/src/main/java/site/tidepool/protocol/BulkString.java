package site.tidepool.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;
import site.tidepool.datastructure.RedisBytes;

/**
 * 批量字符串，二进制安全。
 *
 * <p>content 为 null 时表示空值回复 "$-1\r\n"，用于 GET 不存在的键、LPOP 空列表等场景。
 * 请求中的 "$-1" 参数也会被解码成这种形式。
 *
 * @author tidepool
 * @since 1.0.0
 */
@Getter
public class BulkString extends Resp {

    public static final byte[] NULL_BYTES = "$-1\r\n".getBytes();

    public static final byte[] EMPTY_BULK = "$0\r\n\r\n".getBytes();

    /** 空值回复 */
    public static final BulkString NULL = new BulkString(null);

    private final RedisBytes content;

    public BulkString(final RedisBytes content) {
        this.content = content;
    }

    /**
     * 拷贝传入的数组。
     */
    public static BulkString create(final byte[] content) {
        return content == null ? NULL : new BulkString(new RedisBytes(content));
    }

    public static BulkString create(final RedisBytes content) {
        return content == null ? NULL : new BulkString(content);
    }

    /**
     * 零拷贝包装，调用者保证数组不再被修改。
     */
    public static BulkString wrapTrusted(final byte[] trustedBytes) {
        return trustedBytes == null ? NULL : new BulkString(RedisBytes.wrapTrusted(trustedBytes));
    }

    public static BulkString fromString(final String str) {
        return str == null ? NULL : new BulkString(RedisBytes.fromString(str));
    }

    public boolean isNull() {
        return content == null;
    }

    @Override
    public void encode(final Resp resp, final ByteBuf byteBuf) {
        final RedisBytes value = ((BulkString) resp).getContent();
        if (value == null) {
            byteBuf.writeBytes(NULL_BYTES);
            return;
        }
        final byte[] bytes = value.getBytesUnsafe();
        if (bytes.length == 0) {
            byteBuf.writeBytes(EMPTY_BULK);
            return;
        }
        // '$' + 长度 + CRLF + 内容 + CRLF
        byteBuf.ensureWritable(bytes.length + 16);
        byteBuf.writeByte('$');
        writeLongAsBytes(byteBuf, bytes.length);
        byteBuf.writeBytes(CRLF);
        byteBuf.writeBytes(bytes);
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return content != null ? content.getString() : null;
    }
}
