package site.tidepool.datastructure;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 不可变的二进制安全字节序列，用作键、字符串值、列表元素和流字段。
 *
 * <p>equals/hashCode 基于字节内容，可以直接作为 HashMap 的键。
 * 哈希值在构造时预先计算，字符串形式按需解码并缓存。
 *
 * <p>线程安全性：本类不可变，线程安全。
 *
 * @author tidepool
 * @since 1.0
 */
public final class RedisBytes implements Comparable<RedisBytes> {

    /**
     * 字符串编码解码使用的字符集。
     */
    public static final Charset CHARSET = StandardCharsets.UTF_8;

    /**
     * 空字节序列。
     */
    public static final RedisBytes EMPTY = new RedisBytes(new byte[0], true);

    private final byte[] bytes;

    private final int hashCode;

    /**
     * 延迟解码的字符串形式。
     */
    private volatile String stringValue;

    /**
     * 创建实例并拷贝传入的数组。
     *
     * @param bytes 源字节数组，不能为null
     * @throws IllegalArgumentException 如果bytes为null
     */
    public RedisBytes(final byte[] bytes) {
        this(bytes, false);
    }

    private RedisBytes(final byte[] bytes, final boolean trusted) {
        if (bytes == null) {
            throw new IllegalArgumentException("字节数组不能为null");
        }
        this.bytes = trusted ? bytes : bytes.clone();
        this.hashCode = Arrays.hashCode(this.bytes);
    }

    /**
     * 零拷贝包装。调用者保证之后不再修改该数组，解码器读出的负载即属于这种情况。
     *
     * @param trustedBytes 受信任的字节数组
     * @return RedisBytes实例，输入为null时返回null
     */
    public static RedisBytes wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            return null;
        }
        return new RedisBytes(trustedBytes, true);
    }

    /**
     * 以UTF-8编码字符串。
     *
     * @param str 源字符串
     * @return RedisBytes实例，输入为null时返回null
     */
    public static RedisBytes fromString(final String str) {
        if (str == null) {
            return null;
        }
        if (str.isEmpty()) {
            return EMPTY;
        }
        final RedisBytes redisBytes = new RedisBytes(str.getBytes(CHARSET), true);
        redisBytes.stringValue = str;
        return redisBytes;
    }

    /**
     * 获取字节数组的副本。
     */
    public byte[] getBytes() {
        return bytes.clone();
    }

    /**
     * 获取底层数组的直接引用，只能用于只读场景（编码、比较）。
     */
    public byte[] getBytesUnsafe() {
        return bytes;
    }

    public String getString() {
        String result = stringValue;
        if (result == null) {
            result = new String(bytes, CHARSET);
            stringValue = result;
        }
        return result;
    }

    /**
     * ASCII 大小写不敏感比较，用于命令名和子命令关键字。
     *
     * @param other 另一个字节序列
     * @return 忽略大小写后是否相等
     */
    public boolean equalsIgnoreCase(final RedisBytes other) {
        if (this == other) {
            return true;
        }
        if (other == null || bytes.length != other.bytes.length) {
            return false;
        }
        for (int i = 0; i < bytes.length; i++) {
            if (toLower(bytes[i]) != toLower(other.bytes[i])) {
                return false;
            }
        }
        return true;
    }

    /**
     * 与字符串关键字做大小写不敏感比较。
     *
     * @param keyword ASCII关键字，例如 "COUNT"
     * @return 忽略大小写后是否相等
     */
    public boolean equalsIgnoreCase(final String keyword) {
        if (keyword == null || keyword.length() != bytes.length) {
            return false;
        }
        for (int i = 0; i < bytes.length; i++) {
            if (toLower(bytes[i]) != toLower((byte) keyword.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static byte toLower(final byte b) {
        return b >= 'A' && b <= 'Z' ? (byte) (b + 32) : b;
    }

    public int length() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final RedisBytes other = (RedisBytes) obj;
        return hashCode == other.hashCode && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        // 日志里只显示预览，避免大值刷屏
        final StringBuilder sb = new StringBuilder("RedisBytes[length=").append(bytes.length).append(", preview='");
        for (int i = 0; i < Math.min(bytes.length, 32); i++) {
            final byte b = bytes[i];
            if (b >= 32 && b <= 126) {
                sb.append((char) b);
            } else {
                sb.append("\\x").append(String.format("%02x", b & 0xFF));
            }
        }
        if (bytes.length > 32) {
            sb.append("...");
        }
        return sb.append("']").toString();
    }

    /**
     * 按无符号字节做字典序比较，前缀较短者在前。
     */
    @Override
    public int compareTo(final RedisBytes other) {
        if (other == null) {
            return 1;
        }
        if (this == other) {
            return 0;
        }
        return Arrays.compareUnsigned(bytes, other.bytes);
    }
}
