package site.tidepool.command.impl.list;

import site.tidepool.command.CommandType;
import site.tidepool.datastructure.RedisBytes;
import site.tidepool.datastructure.RedisList;
import site.tidepool.server.context.RedisContext;

import java.util.List;

/**
 * LPUSH命令实现 - 依次把每个值插入到列表头部，最后一个参数成为第一个元素
 * 语法: LPUSH key value1 [value2 ...]
 *
 * @author tidepool
 * @since 1.0
 */
public class Lpush extends AbstractPush {

    public Lpush(final RedisContext redisContext) {
        super(redisContext);
    }

    @Override
    public CommandType getType() {
        return CommandType.LPUSH;
    }

    @Override
    protected void push(final RedisList redisList, final List<RedisBytes> values) {
        redisList.lpush(values);
    }
}
