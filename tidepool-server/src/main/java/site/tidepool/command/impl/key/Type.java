package site.tidepool.command.impl.key;

import site.tidepool.command.Arguments;
import site.tidepool.command.Command;
import site.tidepool.command.CommandType;
import site.tidepool.datastructure.RedisBytes;
import site.tidepool.datastructure.RedisData;
import site.tidepool.protocol.Resp;
import site.tidepool.protocol.SimpleString;
import site.tidepool.server.context.RedisContext;

/**
 * TYPE命令实现 - 返回键的数据类型
 * 语法: TYPE key
 *
 * @author tidepool
 * @since 1.0
 */
public class Type implements Command {

    private static final SimpleString NONE = new SimpleString("none");

    private final RedisContext redisContext;
    private RedisBytes key;

    public Type(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.TYPE;
    }

    @Override
    public void setContext(final Resp[] array) {
        this.key = Arguments.bytes(array[1]);
    }

    @Override
    public Resp handle() {
        final RedisData redisData = redisContext.get(key);
        if (redisData == null) {
            return NONE;
        }
        return SimpleString.valueOf(redisData.getTypeName());
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
