package site.tidepool.server.context;

import lombok.extern.slf4j.Slf4j;
import site.tidepool.blocking.BlockingCoordinator;
import site.tidepool.core.RedisCore;
import site.tidepool.datastructure.RedisBytes;
import site.tidepool.datastructure.RedisData;
import site.tidepool.datastructure.RedisList;
import site.tidepool.datastructure.RedisSet;
import site.tidepool.datastructure.RedisStream;
import site.tidepool.datastructure.RedisString;
import site.tidepool.datastructure.StreamIdAllocator;

/**
 * 服务器上下文实现
 *
 * <p>组合键空间、阻塞协调器和流ID分配器，关闭动作由服务器在构造时传入。
 *
 * @author tidepool
 * @since 1.0
 */
@Slf4j
public class RedisContextImpl implements RedisContext {

    private final RedisCore redisCore;

    private final BlockingCoordinator blockingCoordinator;

    private final StreamIdAllocator streamIdAllocator;

    private final Runnable shutdownAction;

    /**
     * @param redisCore 键空间
     * @param blockingCoordinator 阻塞协调器
     * @param streamIdAllocator 流ID分配器
     * @param shutdownAction SHUTDOWN 命令触发的动作
     */
    public RedisContextImpl(final RedisCore redisCore,
                            final BlockingCoordinator blockingCoordinator,
                            final StreamIdAllocator streamIdAllocator,
                            final Runnable shutdownAction) {
        this.redisCore = redisCore;
        this.blockingCoordinator = blockingCoordinator;
        this.streamIdAllocator = streamIdAllocator;
        this.shutdownAction = shutdownAction;
    }

    // ========== 数据操作接口实现 ==========

    @Override
    public RedisData get(final RedisBytes key) {
        return redisCore.get(key);
    }

    @Override
    public void put(final RedisBytes key, final RedisData value) {
        redisCore.put(key, value);
    }

    @Override
    public boolean delete(final RedisBytes key) {
        return redisCore.delete(key);
    }

    @Override
    public boolean exists(final RedisBytes key) {
        return redisCore.exists(key);
    }

    @Override
    public void flushAll() {
        final int size = redisCore.size();
        redisCore.flushAll();
        log.info("键空间已清空，删除 {} 个键", size);
    }

    @Override
    public RedisString getString(final RedisBytes key) {
        return redisCore.getString(key);
    }

    @Override
    public RedisList getList(final RedisBytes key) {
        return redisCore.getList(key);
    }

    @Override
    public RedisSet getSet(final RedisBytes key) {
        return redisCore.getSet(key);
    }

    @Override
    public RedisStream getStream(final RedisBytes key) {
        return redisCore.getStream(key);
    }

    // ========== 组件访问 ==========

    @Override
    public RedisCore getRedisCore() {
        return redisCore;
    }

    @Override
    public BlockingCoordinator getBlockingCoordinator() {
        return blockingCoordinator;
    }

    @Override
    public StreamIdAllocator getStreamIdAllocator() {
        return streamIdAllocator;
    }

    @Override
    public void requestShutdown() {
        log.info("收到 SHUTDOWN 命令，准备关闭服务器");
        shutdownAction.run();
    }
}
