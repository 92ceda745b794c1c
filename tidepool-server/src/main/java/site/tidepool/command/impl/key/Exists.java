package site.tidepool.command.impl.key;

import site.tidepool.command.Arguments;
import site.tidepool.command.Command;
import site.tidepool.command.CommandType;
import site.tidepool.datastructure.RedisBytes;
import site.tidepool.protocol.Resp;
import site.tidepool.protocol.RespInteger;
import site.tidepool.server.context.RedisContext;

import java.util.List;

/**
 * EXISTS命令实现 - 统计存在的键，重复的键重复计数
 * 语法: EXISTS key [key ...]
 *
 * @author tidepool
 * @since 1.0
 */
public class Exists implements Command {

    private final RedisContext redisContext;
    private List<RedisBytes> keys;

    public Exists(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.EXISTS;
    }

    @Override
    public void setContext(final Resp[] array) {
        this.keys = Arguments.rest(array, 1);
    }

    @Override
    public Resp handle() {
        long count = 0;
        for (final RedisBytes key : keys) {
            if (redisContext.exists(key)) {
                count++;
            }
        }
        return RespInteger.valueOf(count);
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
