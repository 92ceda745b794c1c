package site.tidepool.command.impl.set;

import site.tidepool.command.Arguments;
import site.tidepool.command.Command;
import site.tidepool.command.CommandType;
import site.tidepool.datastructure.RedisBytes;
import site.tidepool.datastructure.RedisSet;
import site.tidepool.protocol.Resp;
import site.tidepool.protocol.RespInteger;
import site.tidepool.server.context.RedisContext;

/**
 * SCARD命令实现
 * 语法: SCARD key
 */
public class Scard implements Command {

    private final RedisContext redisContext;
    private RedisBytes key;

    public Scard(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.SCARD;
    }

    @Override
    public void setContext(final Resp[] array) {
        this.key = Arguments.bytes(array[1]);
    }

    @Override
    public Resp handle() {
        final RedisSet redisSet = redisContext.getSet(key);
        return RespInteger.valueOf(redisSet == null ? 0 : redisSet.size());
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
