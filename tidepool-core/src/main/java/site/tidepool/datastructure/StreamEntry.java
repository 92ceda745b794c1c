package site.tidepool.datastructure;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 流中的一个条目：ID加上有序的字段值对。
 */
@Getter
public class StreamEntry {

    private final StreamId id;

    private final Map<RedisBytes, RedisBytes> fields;

    /**
     * @param id 条目ID
     * @param fields 字段值对，重复的字段保留第一次出现的位置和最后一次的值
     */
    public StreamEntry(final StreamId id, final LinkedHashMap<RedisBytes, RedisBytes> fields) {
        this.id = id;
        this.fields = Collections.unmodifiableMap(fields);
    }
}
