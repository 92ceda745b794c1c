package site.tidepool.command.impl.list;

import site.tidepool.command.Arguments;
import site.tidepool.command.Command;
import site.tidepool.command.CommandType;
import site.tidepool.datastructure.RedisBytes;
import site.tidepool.datastructure.RedisList;
import site.tidepool.protocol.Resp;
import site.tidepool.protocol.RespInteger;
import site.tidepool.server.context.RedisContext;

/**
 * LLEN命令实现
 * 语法: LLEN key
 *
 * @author tidepool
 * @since 1.0
 */
public class Llen implements Command {

    private final RedisContext redisContext;
    private RedisBytes key;

    public Llen(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.LLEN;
    }

    @Override
    public void setContext(final Resp[] array) {
        this.key = Arguments.bytes(array[1]);
    }

    @Override
    public Resp handle() {
        final RedisList redisList = redisContext.getList(key);
        return RespInteger.valueOf(redisList == null ? 0 : redisList.size());
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
