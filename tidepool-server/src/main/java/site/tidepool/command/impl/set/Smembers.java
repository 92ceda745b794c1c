package site.tidepool.command.impl.set;

import site.tidepool.command.Arguments;
import site.tidepool.command.Command;
import site.tidepool.command.CommandType;
import site.tidepool.datastructure.RedisBytes;
import site.tidepool.datastructure.RedisSet;
import site.tidepool.protocol.Resp;
import site.tidepool.protocol.RespArray;
import site.tidepool.server.context.RedisContext;

import java.util.Collections;

/**
 * SMEMBERS命令实现 - 按插入顺序返回所有成员
 * 语法: SMEMBERS key
 */
public class Smembers implements Command {

    private final RedisContext redisContext;
    private RedisBytes key;

    public Smembers(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.SMEMBERS;
    }

    @Override
    public void setContext(final Resp[] array) {
        this.key = Arguments.bytes(array[1]);
    }

    @Override
    public Resp handle() {
        final RedisSet redisSet = redisContext.getSet(key);
        return SetAlgebra.toArray(redisSet == null ? Collections.emptyList() : redisSet.getMembers());
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
