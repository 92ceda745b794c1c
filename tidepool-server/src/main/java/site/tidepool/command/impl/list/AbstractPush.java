package site.tidepool.command.impl.list;

import lombok.extern.slf4j.Slf4j;
import site.tidepool.blocking.BlockingCoordinator;
import site.tidepool.command.Arguments;
import site.tidepool.command.Command;
import site.tidepool.datastructure.RedisBytes;
import site.tidepool.datastructure.RedisList;
import site.tidepool.protocol.Resp;
import site.tidepool.protocol.RespInteger;
import site.tidepool.server.context.RedisContext;

import java.util.List;

/**
 * RPUSH 和 LPUSH 的公共部分。
 *
 * <p>回复的长度是推入之后、唤醒等待者之前的列表长度。推入后如果键上有 BLPOP 等待者，
 * 立刻从列表头部取元素唤醒它们；列表被取空时删除键。
 *
 * @author tidepool
 * @since 1.0
 */
@Slf4j
public abstract class AbstractPush implements Command {

    private final RedisContext redisContext;
    private RedisBytes key;
    private List<RedisBytes> elements;

    protected AbstractPush(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public void setContext(final Resp[] array) {
        // 1. 解析键名
        this.key = Arguments.bytes(array[1]);
        // 2. 解析要插入的元素
        this.elements = Arguments.rest(array, 2);
    }

    @Override
    public Resp handle() {
        // 1. 获取或创建列表
        RedisList redisList = redisContext.getList(key);
        if (redisList == null) {
            redisList = new RedisList();
            redisContext.put(key, redisList);
        }

        // 2. 插入元素
        push(redisList, elements);
        final int length = redisList.size();

        // 3. 唤醒等待者
        final BlockingCoordinator coordinator = redisContext.getBlockingCoordinator();
        final int served = coordinator.hasWaiters(key) ? coordinator.serve(key, redisList) : 0;
        if (served > 0 && redisList.isEmpty()) {
            redisContext.delete(key);
        }
        log.trace("{} {} 个元素, 长度={}, 唤醒={}", getType(), elements.size(), length, served);

        // 4. 返回推入后的长度
        return RespInteger.valueOf(length);
    }

    /**
     * 把元素插入列表。
     */
    protected abstract void push(RedisList redisList, List<RedisBytes> values);

    @Override
    public boolean isWriteCommand() {
        return true;
    }
}
