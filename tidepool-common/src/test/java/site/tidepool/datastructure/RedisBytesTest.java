package site.tidepool.datastructure;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RedisBytes 单元测试
 *
 * 测试覆盖：
 * 1. 构造与工厂方法
 * 2. 内容相等与哈希
 * 3. 大小写不敏感比较
 * 4. 字典序
 */
@DisplayName("RedisBytes 单元测试")
class RedisBytesTest {

    @Nested
    @DisplayName("构造函数测试")
    class ConstructorTests {

        @Test
        @DisplayName("标准构造函数会拷贝输入数组")
        void testConstructorCopies() {
            final byte[] source = {'a', 'b', 'c'};
            final RedisBytes rb = new RedisBytes(source);

            // 1. 修改源数组不影响实例
            source[0] = 'z';
            assertEquals("abc", rb.getString());

            // 2. getBytes 返回副本
            rb.getBytes()[1] = 'q';
            assertEquals("abc", rb.getString());
        }

        @Test
        @DisplayName("null 输入抛出异常")
        void testNullRejected() {
            assertThrows(IllegalArgumentException.class, () -> new RedisBytes(null));
        }

        @Test
        @DisplayName("工厂方法对 null 返回 null")
        void testFactoriesWithNull() {
            assertNull(RedisBytes.fromString(null));
            assertNull(RedisBytes.wrapTrusted(null));
        }

        @Test
        @DisplayName("空字符串返回 EMPTY")
        void testEmptyString() {
            assertSame(RedisBytes.EMPTY, RedisBytes.fromString(""));
            assertTrue(RedisBytes.EMPTY.isEmpty());
        }
    }

    @Test
    @DisplayName("二进制内容保持原样")
    void testBinarySafe() {
        final byte[] binary = {0, (byte) 0xff, '\r', '\n', 0x7f};
        final RedisBytes rb = RedisBytes.wrapTrusted(binary);

        assertEquals(5, rb.length());
        assertArrayEquals(binary, rb.getBytes());
        assertTrue(rb.toString().contains("\\x00"));
    }

    @Test
    @DisplayName("内容相同即相等，可以作为 HashMap 键")
    void testEqualsAndHashCode() {
        final RedisBytes a = RedisBytes.fromString("key");
        final RedisBytes b = new RedisBytes("key".getBytes(RedisBytes.CHARSET));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());

        final Map<RedisBytes, String> map = new HashMap<>();
        map.put(a, "v");
        assertEquals("v", map.get(b));
        assertNotEquals(a, RedisBytes.fromString("Key"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"count", "COUNT", "Count", "cOuNt"})
    @DisplayName("关键字大小写不敏感比较")
    void testEqualsIgnoreCase(final String variant) {
        final RedisBytes rb = RedisBytes.fromString(variant);

        assertTrue(rb.equalsIgnoreCase("COUNT"));
        assertTrue(rb.equalsIgnoreCase(RedisBytes.fromString("count")));
        assertFalse(rb.equalsIgnoreCase("COUNTS"));
        assertFalse(rb.equalsIgnoreCase((String) null));
    }

    @Test
    @DisplayName("按无符号字节字典序比较")
    void testCompareTo() {
        final RedisBytes a = RedisBytes.fromString("a");
        final RedisBytes ab = RedisBytes.fromString("ab");
        final RedisBytes high = RedisBytes.wrapTrusted(new byte[]{(byte) 0x80});

        assertTrue(a.compareTo(ab) < 0);
        assertTrue(ab.compareTo(a) > 0);
        assertEquals(0, a.compareTo(RedisBytes.fromString("a")));
        assertTrue(a.compareTo(high) < 0);
        assertTrue(a.compareTo(null) > 0);
    }
}
