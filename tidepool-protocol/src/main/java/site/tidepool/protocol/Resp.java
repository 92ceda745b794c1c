package site.tidepool.protocol;

import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;

/**
 * RESP2 回复类型的基类。
 *
 * <p>服务端只需要编码五种回复形态：
 * <ul>
 *     <li>简单字符串 - "+OK\r\n"</li>
 *     <li>错误消息 - "-ERR message\r\n"</li>
 *     <li>整数 - ":1000\r\n"</li>
 *     <li>批量字符串 - "$6\r\nfoobar\r\n"，以及空值 "$-1\r\n"</li>
 *     <li>数组 - "*2\r\n$3\r\nfoo\r\n$3\r\nbar\r\n"，以及空值 "*-1\r\n"，可以嵌套</li>
 * </ul>
 *
 * <p>请求方向的解析由 {@link site.tidepool.protocol.handler.RespDecoder} 负责。
 *
 * @author tidepool
 * @since 1.0.0
 */
public abstract class Resp {
    /** 行结束符 */
    public static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 最大缓存数字 */
    protected static final int MAX_CACHED_NUMBER = 255;

    /** 0..255 以及 -1..-255 的字节表示 */
    private static final byte[][] NUMBERS = new byte[(MAX_CACHED_NUMBER + 1) * 2][];

    static {
        for (int i = 0; i <= MAX_CACHED_NUMBER; i++) {
            NUMBERS[i] = String.valueOf(i).getBytes(StandardCharsets.US_ASCII);
        }
        for (int i = 1; i <= MAX_CACHED_NUMBER; i++) {
            NUMBERS[i + MAX_CACHED_NUMBER + 1] = String.valueOf(-i).getBytes(StandardCharsets.US_ASCII);
        }
    }

    /**
     * 以十进制ASCII写入整数，小数字走缓存。
     *
     * @param buf 目标缓冲区
     * @param value 要写入的值
     */
    protected static void writeLongAsBytes(final ByteBuf buf, final long value) {
        if (value >= 0 && value <= MAX_CACHED_NUMBER) {
            buf.writeBytes(NUMBERS[(int) value]);
        } else if (value < 0 && value >= -MAX_CACHED_NUMBER) {
            buf.writeBytes(NUMBERS[(int) -value + MAX_CACHED_NUMBER + 1]);
        } else {
            buf.writeBytes(Long.toString(value).getBytes(StandardCharsets.US_ASCII));
        }
    }

    /**
     * 把回复编码进输出缓冲区。
     *
     * @param resp 回复对象
     * @param byteBuf 输出缓冲区
     */
    public abstract void encode(Resp resp, ByteBuf byteBuf);
}
