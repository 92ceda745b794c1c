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
 * DEL命令实现 - 删除键，返回实际删除的个数
 * 语法: DEL key [key ...]
 *
 * @author tidepool
 * @since 1.0
 */
public class Del implements Command {

    private final RedisContext redisContext;
    private List<RedisBytes> keys;

    public Del(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.DEL;
    }

    @Override
    public void setContext(final Resp[] array) {
        this.keys = Arguments.rest(array, 1);
    }

    @Override
    public Resp handle() {
        long deleted = 0;
        for (final RedisBytes key : keys) {
            if (redisContext.delete(key)) {
                deleted++;
            }
        }
        return RespInteger.valueOf(deleted);
    }

    @Override
    public boolean isWriteCommand() {
        return true;
    }
}
