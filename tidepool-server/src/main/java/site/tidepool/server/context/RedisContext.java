package site.tidepool.server.context;

import site.tidepool.blocking.BlockingCoordinator;
import site.tidepool.core.RedisCore;
import site.tidepool.datastructure.RedisBytes;
import site.tidepool.datastructure.RedisData;
import site.tidepool.datastructure.RedisList;
import site.tidepool.datastructure.RedisSet;
import site.tidepool.datastructure.RedisStream;
import site.tidepool.datastructure.RedisString;
import site.tidepool.datastructure.StreamIdAllocator;
import site.tidepool.exception.WrongTypeException;

/**
 * 服务器上下文接口，命令通过它访问键空间和服务器级别的功能。
 *
 * <p>所有方法都只能在命令执行线程上调用。
 *
 * @author tidepool
 * @since 1.0
 */
public interface RedisContext {

    // ========== 数据操作接口 ==========

    /**
     * 获取指定键的数据。
     *
     * @param key 键
     * @return 值，不存在时返回null
     */
    RedisData get(RedisBytes key);

    /**
     * 存储键值对，覆盖已有的值。
     *
     * @param key 键
     * @param value 值
     */
    void put(RedisBytes key, RedisData value);

    /**
     * 删除键。
     *
     * @param key 键
     * @return 键存在并被删除时返回true
     */
    boolean delete(RedisBytes key);

    boolean exists(RedisBytes key);

    /**
     * 清空键空间。
     */
    void flushAll();

    // ========== 带类型的读取 ==========

    RedisString getString(RedisBytes key) throws WrongTypeException;

    RedisList getList(RedisBytes key) throws WrongTypeException;

    RedisSet getSet(RedisBytes key) throws WrongTypeException;

    RedisStream getStream(RedisBytes key) throws WrongTypeException;

    // ========== 组件访问 ==========

    RedisCore getRedisCore();

    /**
     * 获取阻塞弹出协调器，推入命令和 BLPOP 共用同一个实例。
     */
    BlockingCoordinator getBlockingCoordinator();

    StreamIdAllocator getStreamIdAllocator();

    // ========== 服务器控制 ==========

    /**
     * 请求关闭服务器进程。调用后当前命令不再回复。
     */
    void requestShutdown();
}
