package site.tidepool.core;

import lombok.extern.slf4j.Slf4j;
import site.tidepool.database.RedisDB;
import site.tidepool.datastructure.RedisBytes;
import site.tidepool.datastructure.RedisData;
import site.tidepool.datastructure.RedisList;
import site.tidepool.datastructure.RedisSet;
import site.tidepool.datastructure.RedisStream;
import site.tidepool.datastructure.RedisString;
import site.tidepool.exception.WrongTypeException;

/**
 * 数据操作实现类
 *
 * <p>包装单个 {@link RedisDB}，在其上提供带类型检查的读取方法。
 *
 * @author tidepool
 * @since 1.0.0
 */
@Slf4j
public class RedisCoreImpl implements RedisCore {

    private final RedisDB db;

    public RedisCoreImpl() {
        this(new RedisDB());
    }

    public RedisCoreImpl(final RedisDB db) {
        this.db = db;
    }

    @Override
    public void put(final RedisBytes key, final RedisData value) {
        db.put(key, value);
    }

    @Override
    public RedisData get(final RedisBytes key) {
        return db.get(key);
    }

    @Override
    public boolean delete(final RedisBytes key) {
        return db.delete(key) != null;
    }

    @Override
    public boolean exists(final RedisBytes key) {
        return db.exist(key);
    }

    @Override
    public int size() {
        return db.size();
    }

    @Override
    public void flushAll() {
        final int removed = db.size();
        db.clear();
        log.debug("键空间已清空，删除 {} 个键", removed);
    }

    @Override
    public RedisString getString(final RedisBytes key) {
        return typed(key, RedisString.class);
    }

    @Override
    public RedisList getList(final RedisBytes key) {
        return typed(key, RedisList.class);
    }

    @Override
    public RedisSet getSet(final RedisBytes key) {
        return typed(key, RedisSet.class);
    }

    @Override
    public RedisStream getStream(final RedisBytes key) {
        return typed(key, RedisStream.class);
    }

    private <T extends RedisData> T typed(final RedisBytes key, final Class<T> type) {
        final RedisData data = db.get(key);
        if (data == null) {
            return null;
        }
        if (!type.isInstance(data)) {
            throw new WrongTypeException();
        }
        return type.cast(data);
    }
}
