package site.tidepool.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

/**
 * 整数回复，取值范围为有符号64位。
 *
 * <p>-10 到 127 之间的实例被缓存，优先使用 {@link #valueOf(long)}。
 */
@Getter
public class RespInteger extends Resp {

    private static final int CACHE_LOW = -10;
    private static final int CACHE_HIGH = 127;
    private static final RespInteger[] CACHE = new RespInteger[CACHE_HIGH - CACHE_LOW + 1];

    static {
        for (int i = 0; i < CACHE.length; i++) {
            CACHE[i] = new RespInteger(i + CACHE_LOW);
        }
    }

    public static final RespInteger ZERO = CACHE[-CACHE_LOW];
    public static final RespInteger ONE = CACHE[1 - CACHE_LOW];

    private final long content;

    private RespInteger(final long content) {
        this.content = content;
    }

    public static RespInteger valueOf(final long value) {
        if (value >= CACHE_LOW && value <= CACHE_HIGH) {
            return CACHE[(int) value - CACHE_LOW];
        }
        return new RespInteger(value);
    }

    @Override
    public void encode(final Resp resp, final ByteBuf byteBuf) {
        byteBuf.writeByte(':');
        writeLongAsBytes(byteBuf, ((RespInteger) resp).getContent());
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return Long.toString(content);
    }
}
