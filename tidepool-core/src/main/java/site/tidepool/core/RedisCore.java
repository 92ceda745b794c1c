package site.tidepool.core;

import site.tidepool.datastructure.RedisBytes;
import site.tidepool.datastructure.RedisData;
import site.tidepool.datastructure.RedisList;
import site.tidepool.datastructure.RedisSet;
import site.tidepool.datastructure.RedisStream;
import site.tidepool.datastructure.RedisString;
import site.tidepool.exception.WrongTypeException;

/**
 * 数据操作接口
 *
 * <p>命令通过它读写键空间。带类型的读取方法在键不存在时返回null，
 * 键存在但类型不符时抛出 {@link WrongTypeException}，这样命令不需要自己做类型判断。
 *
 * <p>接口不是线程安全的，调用方保证只在命令执行线程上访问。
 *
 * @author tidepool
 * @since 1.0.0
 */
public interface RedisCore {

    /**
     * 存储键值对，覆盖已有的任何类型的值。
     *
     * @param key 键
     * @param value 值
     */
    void put(RedisBytes key, RedisData value);

    /**
     * 获取键对应的值。
     *
     * @param key 键
     * @return 值，不存在时返回null
     */
    RedisData get(RedisBytes key);

    /**
     * 删除键。
     *
     * @param key 键
     * @return 键存在并被删除时返回true
     */
    boolean delete(RedisBytes key);

    boolean exists(RedisBytes key);

    int size();

    /**
     * 清空整个键空间。
     */
    void flushAll();

    RedisString getString(RedisBytes key) throws WrongTypeException;

    RedisList getList(RedisBytes key) throws WrongTypeException;

    RedisSet getSet(RedisBytes key) throws WrongTypeException;

    RedisStream getStream(RedisBytes key) throws WrongTypeException;
}
