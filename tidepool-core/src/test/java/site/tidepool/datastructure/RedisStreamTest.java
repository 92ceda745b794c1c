package site.tidepool.datastructure;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RedisStream单元测试")
class RedisStreamTest {

    private RedisStream stream;

    @BeforeEach
    void setUp() {
        stream = new RedisStream();
        for (final String id : new String[]{"1-0", "1-1", "2-0", "5-3", "9-0"}) {
            stream.append(entry(id));
        }
    }

    private static StreamEntry entry(final String id) {
        final LinkedHashMap<RedisBytes, RedisBytes> fields = new LinkedHashMap<>();
        fields.put(RedisBytes.fromString("f"), RedisBytes.fromString(id));
        return new StreamEntry(StreamId.parse(id), fields);
    }

    private static List<String> ids(final List<StreamEntry> entries) {
        return entries.stream().map(e -> e.getId().toString()).collect(Collectors.toList());
    }

    @Test
    @DisplayName("追加会更新最后ID")
    void testAppend() {
        assertThat(stream.size()).isEqualTo(5);
        assertThat(stream.getLastId()).isEqualTo(new StreamId(9, 0));
        assertThat(stream.getTypeName()).isEqualTo("stream");
    }

    @Test
    @DisplayName("不递增的ID被拒绝")
    void testAppendRejectsNonIncreasing() {
        assertThatThrownBy(() -> stream.append(entry("9-0"))).isInstanceOf(IllegalArgumentException.class);
        assertThat(stream.size()).isEqualTo(5);
    }

    @Test
    @DisplayName("闭区间范围查询")
    void testRange() {
        assertThat(ids(stream.range(StreamId.MIN, StreamId.MAX, -1)))
                .containsExactly("1-0", "1-1", "2-0", "5-3", "9-0");
        assertThat(ids(stream.range(new StreamId(1, 1), new StreamId(5, 3), -1)))
                .containsExactly("1-1", "2-0", "5-3");
        assertThat(ids(stream.range(StreamId.parseBound("1", false), StreamId.parseBound("2", true), -1)))
                .containsExactly("1-0", "1-1", "2-0");
        assertThat(ids(stream.range(new StreamId(3, 0), new StreamId(4, 0), -1))).isEmpty();
        assertThat(ids(stream.range(new StreamId(9, 0), new StreamId(1, 0), -1))).isEmpty();
    }

    @Test
    @DisplayName("COUNT 限制条数")
    void testRangeWithCount() {
        assertThat(ids(stream.range(StreamId.MIN, StreamId.MAX, 2))).containsExactly("1-0", "1-1");
        assertThat(stream.range(StreamId.MIN, StreamId.MAX, 0)).isEmpty();
    }

    @Test
    @DisplayName("重复字段保留第一次的位置和最后一次的值")
    void testDuplicateFields() {
        final LinkedHashMap<RedisBytes, RedisBytes> fields = new LinkedHashMap<>();
        fields.put(RedisBytes.fromString("a"), RedisBytes.fromString("1"));
        fields.put(RedisBytes.fromString("b"), RedisBytes.fromString("2"));
        fields.put(RedisBytes.fromString("a"), RedisBytes.fromString("3"));
        final StreamEntry entry = new StreamEntry(new StreamId(10, 0), fields);

        assertThat(entry.getFields().keySet()).containsExactly(RedisBytes.fromString("a"), RedisBytes.fromString("b"));
        assertThat(entry.getFields().get(RedisBytes.fromString("a"))).isEqualTo(RedisBytes.fromString("3"));
    }
}
