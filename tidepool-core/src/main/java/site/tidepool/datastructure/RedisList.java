package site.tidepool.datastructure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;

/**
 * 列表数据结构实现
 *
 * <p>底层是 LinkedList，两端的插入和弹出都是常数时间。
 * 列表变空之后由调用方把键删掉，本类不感知键空间。
 *
 * @author tidepool
 * @since 1.0.0
 */
public class RedisList implements RedisData {

    private final LinkedList<RedisBytes> list = new LinkedList<>();

    @Override
    public String getTypeName() {
        return "list";
    }

    public int size() {
        return list.size();
    }

    public boolean isEmpty() {
        return list.isEmpty();
    }

    /**
     * 向列表左端推入元素。每个元素都插到最前面，
     * 所以 LPUSH k a b c 之后列表是 [c, b, a]。
     *
     * @param values 要推入的元素
     */
    public void lpush(final List<RedisBytes> values) {
        for (final RedisBytes value : values) {
            list.addFirst(value);
        }
    }

    /**
     * 向列表右端追加元素。
     *
     * @param values 要推入的元素
     */
    public void rpush(final List<RedisBytes> values) {
        list.addAll(values);
    }

    /**
     * 弹出左端元素。
     *
     * @return 弹出的元素，列表为空时返回null
     */
    public RedisBytes lpop() {
        return list.pollFirst();
    }

    /**
     * 从左端最多弹出 count 个元素。
     */
    public List<RedisBytes> lpop(final long count) {
        final int n = (int) Math.min(count, list.size());
        final List<RedisBytes> popped = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            popped.add(list.pollFirst());
        }
        return popped;
    }

    /**
     * 获取闭区间 [start, stop] 内的元素。
     *
     * <p>负数下标从末尾计数，-1 是最后一个元素。越界的下标被截断到有效范围，
     * 截断后 start 大于 stop 时返回空列表。
     *
     * @param start 开始下标
     * @param stop 结束下标（包含）
     * @return 元素快照
     */
    public List<RedisBytes> lrange(final long start, final long stop) {
        final long size = list.size();
        // 1. 处理负数下标
        long from = start < 0 ? size + start : start;
        long to = stop < 0 ? size + stop : stop;
        // 2. 截断到有效范围
        from = Math.max(0, from);
        to = Math.min(size - 1, to);
        // 3. 返回子列表
        if (from > to || from >= size) {
            return Collections.emptyList();
        }
        return new ArrayList<>(list.subList((int) from, (int) to + 1));
    }
}
