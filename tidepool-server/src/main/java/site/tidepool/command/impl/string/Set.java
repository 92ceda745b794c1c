package site.tidepool.command.impl.string;

import site.tidepool.command.Arguments;
import site.tidepool.command.Command;
import site.tidepool.command.CommandType;
import site.tidepool.datastructure.RedisBytes;
import site.tidepool.datastructure.RedisString;
import site.tidepool.protocol.Resp;
import site.tidepool.protocol.SimpleString;
import site.tidepool.server.context.RedisContext;

/**
 * SET命令实现 - 设置字符串值，覆盖任何类型的旧值
 * 语法: SET key value
 *
 * @author tidepool
 * @since 1.0
 */
public class Set implements Command {

    private final RedisContext redisContext;
    private RedisBytes key;
    private RedisBytes value;

    public Set(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.SET;
    }

    @Override
    public void setContext(final Resp[] array) {
        this.key = Arguments.bytes(array[1]);
        this.value = Arguments.bytes(array[2]);
    }

    @Override
    public Resp handle() {
        redisContext.put(key, new RedisString(value));
        return SimpleString.OK;
    }

    @Override
    public boolean isWriteCommand() {
        return true;
    }
}
