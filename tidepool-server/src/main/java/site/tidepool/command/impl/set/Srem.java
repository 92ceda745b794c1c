package site.tidepool.command.impl.set;

import site.tidepool.command.Arguments;
import site.tidepool.command.Command;
import site.tidepool.command.CommandType;
import site.tidepool.datastructure.RedisBytes;
import site.tidepool.datastructure.RedisSet;
import site.tidepool.protocol.Resp;
import site.tidepool.protocol.RespInteger;
import site.tidepool.server.context.RedisContext;

import java.util.List;

/**
 * SREM命令实现 - 移除集合成员，集合为空时删除键
 * 语法: SREM key member [member ...]
 *
 * @author tidepool
 * @since 1.0
 */
public class Srem implements Command {

    private final RedisContext redisContext;
    private RedisBytes key;
    private List<RedisBytes> members;

    public Srem(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.SREM;
    }

    @Override
    public void setContext(final Resp[] array) {
        this.key = Arguments.bytes(array[1]);
        this.members = Arguments.rest(array, 2);
    }

    @Override
    public Resp handle() {
        final RedisSet redisSet = redisContext.getSet(key);
        if (redisSet == null) {
            return RespInteger.ZERO;
        }
        final int removed = redisSet.remove(members);
        if (redisSet.isEmpty()) {
            redisContext.delete(key);
        }
        return RespInteger.valueOf(removed);
    }

    @Override
    public boolean isWriteCommand() {
        return true;
    }
}
