package site.tidepool.datastructure;

import site.tidepool.exception.CommandException;

import java.util.function.LongSupplier;

/**
 * 流条目ID分配器
 *
 * <p>根据流的最后一个ID和 XADD 请求的ID文本决定新条目的ID，支持三种写法：
 * <ul>
 *     <li>"*" - 毫秒取当前时间和最后ID毫秒中的较大者，同一毫秒内序号递增</li>
 *     <li>"ms-*" - 指定毫秒，序号自动生成</li>
 *     <li>"ms-seq" - 完全指定，必须严格大于最后ID</li>
 * </ul>
 *
 * <p>空流的最后ID视为 0-0。时钟通过 {@link LongSupplier} 注入，测试中可以固定。
 *
 * @author tidepool
 * @since 1.0.0
 */
public class StreamIdAllocator {

    public static final String AUTO = "*";

    private static final String ZERO_ID_MESSAGE = "ERR The ID specified in XADD must be greater than 0-0";

    private static final String NOT_INCREASING_MESSAGE =
            "ERR The ID specified in XADD is equal or smaller than the target stream top item";

    private static final String EXHAUSTED_MESSAGE =
            "ERR The stream has exhausted the last possible ID, unable to add more items";

    private final LongSupplier clock;

    public StreamIdAllocator(final LongSupplier clock) {
        this.clock = clock;
    }

    public StreamIdAllocator() {
        this(System::currentTimeMillis);
    }

    /**
     * 计算下一个ID，不修改任何状态。
     *
     * @param last 流当前的最后ID，空流为 {@link StreamId#MIN}
     * @param requested XADD 的ID参数
     * @return 新条目的ID
     * @throws CommandException ID格式不合法或不递增
     */
    public StreamId next(final StreamId last, final String requested) {
        // 1. 全自动
        if (AUTO.equals(requested)) {
            final long ms = Math.max(clock.getAsLong(), last.getMs());
            if (ms == last.getMs()) {
                return successor(last);
            }
            return new StreamId(ms, 0);
        }

        // 2. 指定毫秒，序号自动
        if (requested.endsWith("-*")) {
            final long ms = StreamId.parseComponent(requested.substring(0, requested.length() - 2));
            if (ms < last.getMs()) {
                throw new CommandException(NOT_INCREASING_MESSAGE);
            }
            if (ms == last.getMs()) {
                if (last.getSeq() == Long.MAX_VALUE) {
                    throw new CommandException(NOT_INCREASING_MESSAGE);
                }
                return new StreamId(ms, last.getSeq() + 1);
            }
            return new StreamId(ms, 0);
        }

        // 3. 完全指定
        final StreamId id = StreamId.parse(requested);
        if (id.equals(StreamId.MIN)) {
            throw new CommandException(ZERO_ID_MESSAGE);
        }
        if (id.compareTo(last) <= 0) {
            throw new CommandException(NOT_INCREASING_MESSAGE);
        }
        return id;
    }

    private static StreamId successor(final StreamId last) {
        if (last.getSeq() == Long.MAX_VALUE) {
            if (last.getMs() == Long.MAX_VALUE) {
                throw new CommandException(EXHAUSTED_MESSAGE);
            }
            return new StreamId(last.getMs() + 1, 0);
        }
        return new StreamId(last.getMs(), last.getSeq() + 1);
    }
}
