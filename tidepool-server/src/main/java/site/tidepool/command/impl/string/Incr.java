package site.tidepool.command.impl.string;

import lombok.extern.slf4j.Slf4j;
import site.tidepool.command.Arguments;
import site.tidepool.command.Command;
import site.tidepool.command.CommandType;
import site.tidepool.datastructure.RedisBytes;
import site.tidepool.datastructure.RedisString;
import site.tidepool.exception.CommandException;
import site.tidepool.protocol.Resp;
import site.tidepool.protocol.RespInteger;
import site.tidepool.server.context.RedisContext;

/**
 * INCR命令实现 - 将key中储存的数字值增一
 * 语法: INCR key
 *
 * <p>键不存在时按0处理。值必须是严格的十进制64位整数，溢出时报错且不修改原值。
 *
 * @author tidepool
 * @since 1.0
 */
@Slf4j
public class Incr implements Command {

    private final RedisContext redisContext;
    private RedisBytes key;

    public Incr(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.INCR;
    }

    @Override
    public void setContext(final Resp[] array) {
        this.key = Arguments.bytes(array[1]);
    }

    @Override
    public Resp handle() {
        // 1. 读取当前值
        final RedisString redisString = redisContext.getString(key);
        final long current = redisString == null ? 0 : Arguments.parseLong(redisString.getValue());

        // 2. 加一
        final long next;
        try {
            next = Math.addExact(current, 1);
        } catch (ArithmeticException e) {
            throw CommandException.notInteger();
        }

        // 3. 写回
        redisContext.put(key, new RedisString(RedisBytes.fromString(Long.toString(next))));
        log.trace("INCR {} -> {}", key, next);
        return RespInteger.valueOf(next);
    }

    @Override
    public boolean isWriteCommand() {
        return true;
    }
}
