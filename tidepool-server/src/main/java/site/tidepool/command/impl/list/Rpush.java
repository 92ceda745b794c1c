package site.tidepool.command.impl.list;

import site.tidepool.command.CommandType;
import site.tidepool.datastructure.RedisBytes;
import site.tidepool.datastructure.RedisList;
import site.tidepool.server.context.RedisContext;

import java.util.List;

/**
 * RPUSH命令实现 - 将一个或多个值插入到列表尾部
 * 语法: RPUSH key value1 [value2 ...]
 *
 * @author tidepool
 * @since 1.0
 */
public class Rpush extends AbstractPush {

    public Rpush(final RedisContext redisContext) {
        super(redisContext);
    }

    @Override
    public CommandType getType() {
        return CommandType.RPUSH;
    }

    @Override
    protected void push(final RedisList redisList, final List<RedisBytes> values) {
        redisList.rpush(values);
    }
}
