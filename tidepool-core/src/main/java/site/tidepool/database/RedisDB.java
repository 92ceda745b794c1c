package site.tidepool.database;

import site.tidepool.datastructure.RedisBytes;
import site.tidepool.datastructure.RedisData;

import java.util.HashMap;
import java.util.Map;

/**
 * 键空间
 *
 * <p>一个普通的 HashMap。所有访问都发生在命令执行线程上，不需要同步。
 * 值不带过期时间，只会被覆盖、删除或清空。
 *
 * @author tidepool
 * @since 1.0.0
 */
public class RedisDB {

    private final Map<RedisBytes, RedisData> data = new HashMap<>();

    public boolean exist(final RedisBytes key) {
        return data.containsKey(key);
    }

    public void put(final RedisBytes key, final RedisData value) {
        data.put(key, value);
    }

    public RedisData get(final RedisBytes key) {
        return data.get(key);
    }

    /**
     * @return 被删除的值，键不存在时返回null
     */
    public RedisData delete(final RedisBytes key) {
        return data.remove(key);
    }

    public int size() {
        return data.size();
    }

    public void clear() {
        data.clear();
    }
}
