package site.tidepool.datastructure;

import site.tidepool.exception.CommandException;

/**
 * 流条目ID，形如 "ms-seq"，按 (ms, seq) 字典序比较。
 *
 * <p>两个分量都是非负的 long。
 *
 * @author tidepool
 * @since 1.0.0
 */
public final class StreamId implements Comparable<StreamId> {

    public static final StreamId MIN = new StreamId(0, 0);

    public static final StreamId MAX = new StreamId(Long.MAX_VALUE, Long.MAX_VALUE);

    private final long ms;

    private final long seq;

    public StreamId(final long ms, final long seq) {
        if (ms < 0 || seq < 0) {
            throw new IllegalArgumentException("stream id components must be non-negative: " + ms + "-" + seq);
        }
        this.ms = ms;
        this.seq = seq;
    }

    public long getMs() {
        return ms;
    }

    public long getSeq() {
        return seq;
    }

    /**
     * 解析完整的 "ms-seq" 形式。
     *
     * @throws CommandException 格式不合法
     */
    public static StreamId parse(final String text) {
        final int dash = text.indexOf('-');
        if (dash <= 0 || dash == text.length() - 1) {
            throw CommandException.invalidStreamId();
        }
        return new StreamId(parseComponent(text.substring(0, dash)), parseComponent(text.substring(dash + 1)));
    }

    /**
     * 解析 XRANGE 的区间端点。
     *
     * <p>"-" 和 "+" 表示最小和最大ID。只给出毫秒时，起点补成 ms-0，终点补成 ms-最大序号。
     *
     * @param text 端点文本
     * @param end 是否为区间终点
     * @return 解析后的ID
     */
    public static StreamId parseBound(final String text, final boolean end) {
        if ("-".equals(text)) {
            return MIN;
        }
        if ("+".equals(text)) {
            return MAX;
        }
        if (text.indexOf('-') < 0) {
            return new StreamId(parseComponent(text), end ? Long.MAX_VALUE : 0);
        }
        return parse(text);
    }

    /**
     * 解析一个非负十进制分量，只接受数字。
     */
    static long parseComponent(final String text) {
        if (text.isEmpty() || text.length() > 19) {
            throw CommandException.invalidStreamId();
        }
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c < '0' || c > '9') {
                throw CommandException.invalidStreamId();
            }
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw CommandException.invalidStreamId();
        }
    }

    @Override
    public int compareTo(final StreamId other) {
        final int byMs = Long.compare(ms, other.ms);
        return byMs != 0 ? byMs : Long.compare(seq, other.seq);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof StreamId)) {
            return false;
        }
        final StreamId other = (StreamId) obj;
        return ms == other.ms && seq == other.seq;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(ms) * 31 + Long.hashCode(seq);
    }

    @Override
    public String toString() {
        return ms + "-" + seq;
    }
}
