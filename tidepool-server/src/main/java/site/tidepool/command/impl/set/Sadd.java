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
 * SADD命令实现 - 向集合添加成员
 * 语法: SADD key member [member ...]
 *
 * @author tidepool
 * @since 1.0
 */
public class Sadd implements Command {

    private final RedisContext redisContext;
    private RedisBytes key;
    private List<RedisBytes> members;

    public Sadd(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.SADD;
    }

    @Override
    public void setContext(final Resp[] array) {
        this.key = Arguments.bytes(array[1]);
        this.members = Arguments.rest(array, 2);
    }

    @Override
    public Resp handle() {
        RedisSet redisSet = redisContext.getSet(key);
        if (redisSet == null) {
            redisSet = new RedisSet();
            redisContext.put(key, redisSet);
        }
        return RespInteger.valueOf(redisSet.add(members));
    }

    @Override
    public boolean isWriteCommand() {
        return true;
    }
}
