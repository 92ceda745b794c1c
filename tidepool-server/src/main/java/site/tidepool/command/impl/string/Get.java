package site.tidepool.command.impl.string;

import site.tidepool.command.Arguments;
import site.tidepool.command.Command;
import site.tidepool.command.CommandType;
import site.tidepool.datastructure.RedisBytes;
import site.tidepool.datastructure.RedisString;
import site.tidepool.protocol.BulkString;
import site.tidepool.protocol.Resp;
import site.tidepool.server.context.RedisContext;

/**
 * GET命令实现
 * 语法: GET key
 *
 * @author tidepool
 * @since 1.0
 */
public class Get implements Command {

    private final RedisContext redisContext;
    private RedisBytes key;

    public Get(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.GET;
    }

    @Override
    public void setContext(final Resp[] array) {
        this.key = Arguments.bytes(array[1]);
    }

    @Override
    public Resp handle() {
        final RedisString redisString = redisContext.getString(key);
        if (redisString == null) {
            return BulkString.NULL;
        }
        return BulkString.create(redisString.getValue());
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
