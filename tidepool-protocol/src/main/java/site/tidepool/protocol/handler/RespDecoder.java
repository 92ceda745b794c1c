package site.tidepool.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import lombok.extern.slf4j.Slf4j;
import site.tidepool.protocol.BulkString;
import site.tidepool.protocol.Resp;
import site.tidepool.protocol.RespArray;
import site.tidepool.protocol.RespProtocolException;

import java.util.ArrayList;
import java.util.List;

/**
 * 请求解码器
 *
 * <p>把客户端字节流解码成 {@link RespArray}，元素全部是 {@link BulkString}。
 * 支持两种请求格式：
 * <ul>
 *     <li>多批量格式 - "*2\r\n$4\r\nECHO\r\n$2\r\nhi\r\n"</li>
 *     <li>INLINE格式 - "PING\r\n"，按空白切分参数</li>
 * </ul>
 *
 * <p>解码器是一个显式的状态机，状态保存在实例里，所以一个帧可以拆成任意多次读事件到达，
 * 已经读完的元素不会被重复解析。每个连接持有自己的实例，不可共享。
 *
 * <p>格式错误时抛出 {@link RespProtocolException} 并进入丢弃状态，之后收到的字节全部忽略。
 * Netty 会把异常包装成 DecoderException 传给后续 handler，由它回复错误并关闭连接。
 * 连接关闭时残留的不完整帧不抛异常，{@link #decodeLast} 只记录警告并丢弃，此时已经无法回复客户端。
 *
 * @author tidepool
 * @since 1.0.0
 */
@Slf4j
public class RespDecoder extends ByteToMessageDecoder {

    /** 默认最大内联命令长度 */
    public static final int DEFAULT_MAX_INLINE_LENGTH = 64 * 1024;

    /** 默认最大批量字符串长度 */
    public static final int DEFAULT_MAX_BULK_LENGTH = 512 * 1024 * 1024;

    /** 默认最大数组元素个数 */
    public static final int DEFAULT_MAX_ARRAY_LENGTH = 1024 * 1024;

    enum State {
        /** 等待帧的第一个字节 */
        AWAITING_TYPE,
        /** 读取 "*<n>\r\n" */
        READ_ARRAY_LENGTH,
        /** 读取 "$<n>\r\n" */
        READ_ELEMENT_LENGTH,
        /** 读取 n 字节负载和结尾的 CRLF */
        READ_ELEMENT_PAYLOAD,
        /** 读取一整行内联命令 */
        READ_INLINE,
        /** 出错之后丢弃所有输入 */
        DISCARDING
    }

    private final int maxInlineLength;
    private final int maxBulkLength;
    private final int maxArrayLength;

    private State state = State.AWAITING_TYPE;

    /** 当前帧已解析出的元素 */
    private Resp[] elements;
    private int elementIndex;
    private int bulkLength;

    public RespDecoder() {
        this(DEFAULT_MAX_INLINE_LENGTH, DEFAULT_MAX_BULK_LENGTH, DEFAULT_MAX_ARRAY_LENGTH);
    }

    public RespDecoder(final int maxInlineLength, final int maxBulkLength, final int maxArrayLength) {
        this.maxInlineLength = maxInlineLength;
        this.maxBulkLength = maxBulkLength;
        this.maxArrayLength = maxArrayLength;
    }

    @Override
    protected void decode(final ChannelHandlerContext ctx, final ByteBuf in, final List<Object> out) {
        while (true) {
            switch (state) {
                case AWAITING_TYPE:
                    if (!in.isReadable()) {
                        return;
                    }
                    final byte first = in.getByte(in.readerIndex());
                    // 1. 跳过帧之间多余的换行
                    if (first == '\r' || first == '\n') {
                        in.skipBytes(1);
                        continue;
                    }
                    // 2. 判断是多批量格式还是INLINE格式
                    state = first == '*' ? State.READ_ARRAY_LENGTH : State.READ_INLINE;
                    continue;

                case READ_ARRAY_LENGTH:
                    final Long arrayLength = readLength(in, (byte) '*', "multibulk");
                    if (arrayLength == null) {
                        return;
                    }
                    if (arrayLength < -1 || arrayLength > maxArrayLength) {
                        throw fail("invalid multibulk length");
                    }
                    if (arrayLength <= 0) {
                        // "*0" 和 "*-1" 不携带命令，直接忽略
                        state = State.AWAITING_TYPE;
                        continue;
                    }
                    elements = new Resp[arrayLength.intValue()];
                    elementIndex = 0;
                    state = State.READ_ELEMENT_LENGTH;
                    continue;

                case READ_ELEMENT_LENGTH:
                    if (!in.isReadable()) {
                        return;
                    }
                    final byte marker = in.getByte(in.readerIndex());
                    if (marker != '$') {
                        throw fail("expected '$', got '" + (char) marker + "'");
                    }
                    final Long elementLength = readLength(in, (byte) '$', "bulk");
                    if (elementLength == null) {
                        return;
                    }
                    if (elementLength == -1) {
                        addElement(BulkString.NULL, out);
                        continue;
                    }
                    if (elementLength < 0 || elementLength > maxBulkLength) {
                        throw fail("invalid bulk length");
                    }
                    bulkLength = elementLength.intValue();
                    state = State.READ_ELEMENT_PAYLOAD;
                    continue;

                case READ_ELEMENT_PAYLOAD:
                    if (in.readableBytes() < bulkLength + 2L) {
                        return;
                    }
                    final byte[] payload = new byte[bulkLength];
                    in.readBytes(payload);
                    if (in.readByte() != '\r' || in.readByte() != '\n') {
                        throw fail("expected CRLF after bulk payload");
                    }
                    addElement(BulkString.wrapTrusted(payload), out);
                    continue;

                case READ_INLINE:
                    if (!readInline(in, out)) {
                        return;
                    }
                    state = State.AWAITING_TYPE;
                    continue;

                case DISCARDING:
                default:
                    in.skipBytes(in.readableBytes());
                    return;
            }
        }
    }

    /**
     * 连接关闭时仍有未完成的帧，只记录日志，连接已经不可用了。
     */
    @Override
    protected void decodeLast(final ChannelHandlerContext ctx, final ByteBuf in, final List<Object> out) throws Exception {
        if (in.isReadable()) {
            decode(ctx, in, out);
        }
        if (state != State.AWAITING_TYPE && state != State.DISCARDING) {
            log.warn("连接 {} 关闭时请求帧不完整，状态: {}", ctx.channel().remoteAddress(), state);
            resetFrame();
            state = State.AWAITING_TYPE;
        }
    }

    private void addElement(final Resp element, final List<Object> out) {
        elements[elementIndex++] = element;
        if (elementIndex == elements.length) {
            out.add(new RespArray(elements));
            resetFrame();
            state = State.AWAITING_TYPE;
        } else {
            state = State.READ_ELEMENT_LENGTH;
        }
    }

    private void resetFrame() {
        elements = null;
        elementIndex = 0;
        bulkLength = 0;
    }

    /**
     * 读取 "&lt;prefix&gt;&lt;整数&gt;\r\n" 形式的长度行。
     *
     * @return 解析出的长度，行还不完整时返回null
     */
    private Long readLength(final ByteBuf in, final byte prefix, final String kind) {
        final int start = in.readerIndex();
        final int lf = in.indexOf(start, in.writerIndex(), (byte) '\n');
        if (lf < 0) {
            if (in.readableBytes() > maxInlineLength) {
                throw fail("too big " + kind + " count string");
            }
            return null;
        }
        final int end = lf - 1;
        if (end <= start || in.getByte(end) != '\r' || in.getByte(start) != prefix) {
            throw fail("invalid " + kind + " length");
        }
        final long value = parseLong(in, start + 1, end);
        if (value == Long.MIN_VALUE) {
            throw fail("invalid " + kind + " length");
        }
        in.readerIndex(lf + 1);
        return value;
    }

    /**
     * 解析 [from, to) 范围内的十进制整数，允许前导负号。
     *
     * @return 解析结果，格式不合法时返回 Long.MIN_VALUE
     */
    private static long parseLong(final ByteBuf in, final int from, final int to) {
        int index = from;
        boolean negative = false;
        if (index < to && in.getByte(index) == '-') {
            negative = true;
            index++;
        }
        // 长度不会超过 18 位，更长的一律当作非法
        if (index == to || to - index > 18) {
            return Long.MIN_VALUE;
        }
        long value = 0;
        for (; index < to; index++) {
            final byte b = in.getByte(index);
            if (b < '0' || b > '9') {
                return Long.MIN_VALUE;
            }
            value = value * 10 + (b - '0');
        }
        return negative ? -value : value;
    }

    /**
     * 读取一行内联命令，以 \n 结尾，前面的 \r 可选。
     *
     * @return 整行已经消费时返回true，数据不足时返回false
     */
    private boolean readInline(final ByteBuf in, final List<Object> out) {
        final int start = in.readerIndex();
        final int lf = in.indexOf(start, in.writerIndex(), (byte) '\n');
        if (lf < 0) {
            if (in.readableBytes() > maxInlineLength) {
                throw fail("too big inline request");
            }
            return false;
        }
        if (lf - start > maxInlineLength) {
            throw fail("too big inline request");
        }
        final byte[] line = new byte[lf - start];
        in.readBytes(line);
        in.skipBytes(1);

        final List<Resp> parts = splitInline(line);
        if (!parts.isEmpty()) {
            log.debug("解析INLINE命令，参数个数: {}", parts.size());
            out.add(new RespArray(parts.toArray(new Resp[0])));
        }
        return true;
    }

    private static List<Resp> splitInline(final byte[] line) {
        final List<Resp> parts = new ArrayList<>(4);
        int tokenStart = -1;
        for (int i = 0; i <= line.length; i++) {
            final boolean separator = i == line.length || isWhitespace(line[i]);
            if (separator && tokenStart >= 0) {
                final byte[] token = new byte[i - tokenStart];
                System.arraycopy(line, tokenStart, token, 0, token.length);
                parts.add(BulkString.wrapTrusted(token));
                tokenStart = -1;
            } else if (!separator && tokenStart < 0) {
                tokenStart = i;
            }
        }
        return parts;
    }

    private static boolean isWhitespace(final byte b) {
        return b == ' ' || b == '\t' || b == '\r';
    }

    private RespProtocolException fail(final String detail) {
        state = State.DISCARDING;
        resetFrame();
        log.debug("请求格式错误: {}", detail);
        return new RespProtocolException(detail);
    }

    State getState() {
        return state;
    }
}
