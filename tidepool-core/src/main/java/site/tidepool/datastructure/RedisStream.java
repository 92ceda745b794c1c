package site.tidepool.datastructure;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 流数据结构实现
 *
 * <p>条目按ID严格递增追加，因此底层 ArrayList 本身就是有序的，
 * 范围查询用二分查找定位起点。
 *
 * @author tidepool
 * @since 1.0.0
 */
public class RedisStream implements RedisData {

    private final List<StreamEntry> entries = new ArrayList<>();

    /** 最后一个条目的ID，空流为 0-0 */
    @Getter
    private StreamId lastId = StreamId.MIN;

    @Override
    public String getTypeName() {
        return "stream";
    }

    public int size() {
        return entries.size();
    }

    /**
     * 追加条目。ID必须已经由 {@link StreamIdAllocator} 校验过。
     *
     * @throws IllegalArgumentException ID没有大于最后ID
     */
    public void append(final StreamEntry entry) {
        if (entry.getId().compareTo(lastId) <= 0) {
            throw new IllegalArgumentException("stream id " + entry.getId() + " is not greater than " + lastId);
        }
        entries.add(entry);
        lastId = entry.getId();
    }

    /**
     * 返回ID在闭区间 [start, end] 内的条目，按ID升序。
     *
     * @param start 起点
     * @param end 终点
     * @param count 最多返回的条数，负数表示不限制
     * @return 条目快照
     */
    public List<StreamEntry> range(final StreamId start, final StreamId end, final long count) {
        if (start.compareTo(end) > 0 || count == 0 || entries.isEmpty()) {
            return Collections.emptyList();
        }
        final List<StreamEntry> result = new ArrayList<>();
        for (int i = lowerBound(start); i < entries.size(); i++) {
            final StreamEntry entry = entries.get(i);
            if (entry.getId().compareTo(end) > 0 || (count > 0 && result.size() >= count)) {
                break;
            }
            result.add(entry);
        }
        return result;
    }

    /**
     * 第一个ID不小于 id 的条目下标。
     */
    private int lowerBound(final StreamId id) {
        int low = 0;
        int high = entries.size();
        while (low < high) {
            final int mid = (low + high) >>> 1;
            if (entries.get(mid).getId().compareTo(id) < 0) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }
}
