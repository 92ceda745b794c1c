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
 * SISMEMBER命令实现
 * 语法: SISMEMBER key member
 */
public class Sismember implements Command {

    private final RedisContext redisContext;
    private RedisBytes key;
    private RedisBytes member;

    public Sismember(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.SISMEMBER;
    }

    @Override
    public void setContext(final Resp[] array) {
        this.key = Arguments.bytes(array[1]);
        this.member = Arguments.bytes(array[2]);
    }

    @Override
    public Resp handle() {
        final RedisSet redisSet = redisContext.getSet(key);
        return redisSet != null && redisSet.contains(member) ? RespInteger.ONE : RespInteger.ZERO;
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
