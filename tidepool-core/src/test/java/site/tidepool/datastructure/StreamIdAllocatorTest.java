package site.tidepool.datastructure;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.tidepool.exception.CommandException;

import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StreamIdAllocator单元测试")
class StreamIdAllocatorTest {

    private static final String NOT_INCREASING =
            "ERR The ID specified in XADD is equal or smaller than the target stream top item";

    private final AtomicLong now = new AtomicLong(1000);
    private StreamIdAllocator allocator;

    @BeforeEach
    void setUp() {
        allocator = new StreamIdAllocator(now::get);
    }

    @Test
    @DisplayName("自动ID：新毫秒从0开始，同一毫秒内序号递增")
    void testAutoId() {
        // 1. 空流
        final StreamId first = allocator.next(StreamId.MIN, "*");
        assertThat(first).isEqualTo(new StreamId(1000, 0));

        // 2. 同一毫秒
        final StreamId second = allocator.next(first, "*");
        assertThat(second).isEqualTo(new StreamId(1000, 1));

        // 3. 时钟前进
        now.set(1005);
        assertThat(allocator.next(second, "*")).isEqualTo(new StreamId(1005, 0));
    }

    @Test
    @DisplayName("时钟回拨时仍然递增")
    void testClockGoesBackwards() {
        final StreamId last = new StreamId(5000, 3);

        assertThat(allocator.next(last, "*")).isEqualTo(new StreamId(5000, 4));
    }

    @Test
    @DisplayName("毫秒为0的空流自动ID从 0-1 开始")
    void testZeroClock() {
        now.set(0);

        assertThat(allocator.next(StreamId.MIN, "*")).isEqualTo(new StreamId(0, 1));
    }

    @Test
    @DisplayName("序号用尽时进位到下一毫秒，ID空间用尽时报错")
    void testAutoIdAtUpperBound() {
        now.set(3);
        assertThat(allocator.next(new StreamId(3, Long.MAX_VALUE), "*")).isEqualTo(new StreamId(4, 0));

        assertThatThrownBy(() -> allocator.next(new StreamId(Long.MAX_VALUE, Long.MAX_VALUE), "*"))
                .isInstanceOf(CommandException.class)
                .hasMessage("ERR The stream has exhausted the last possible ID, unable to add more items");
    }

    @Test
    @DisplayName("指定毫秒、自动序号")
    void testPartialAuto() {
        assertThat(allocator.next(StreamId.MIN, "0-*")).isEqualTo(new StreamId(0, 1));
        assertThat(allocator.next(StreamId.MIN, "7-*")).isEqualTo(new StreamId(7, 0));
        assertThat(allocator.next(new StreamId(7, 0), "7-*")).isEqualTo(new StreamId(7, 1));
        assertThat(allocator.next(new StreamId(7, 4), "9-*")).isEqualTo(new StreamId(9, 0));

        assertThatThrownBy(() -> allocator.next(new StreamId(7, 4), "6-*"))
                .isInstanceOf(CommandException.class)
                .hasMessage(NOT_INCREASING);
    }

    @Test
    @DisplayName("显式ID必须严格递增")
    void testExplicitId() {
        final StreamId last = new StreamId(10, 5);

        assertThat(allocator.next(last, "10-6")).isEqualTo(new StreamId(10, 6));
        assertThat(allocator.next(last, "11-0")).isEqualTo(new StreamId(11, 0));
        assertThatThrownBy(() -> allocator.next(last, "10-5")).hasMessage(NOT_INCREASING);
        assertThatThrownBy(() -> allocator.next(last, "9-9")).hasMessage(NOT_INCREASING);
    }

    @Test
    @DisplayName("0-0 总是被拒绝")
    void testZeroIdRejected() {
        assertThatThrownBy(() -> allocator.next(StreamId.MIN, "0-0"))
                .isInstanceOf(CommandException.class)
                .hasMessage("ERR The ID specified in XADD must be greater than 0-0");
    }

    @Test
    @DisplayName("格式错误")
    void testInvalidFormat() {
        assertThatThrownBy(() -> allocator.next(StreamId.MIN, "abc"))
                .hasMessage("ERR Invalid stream ID specified as stream command argument");
        assertThatThrownBy(() -> allocator.next(StreamId.MIN, "x-*"))
                .hasMessage("ERR Invalid stream ID specified as stream command argument");
    }
}
