package site.tidepool.command.impl.server;

import site.tidepool.command.Arguments;
import site.tidepool.command.Command;
import site.tidepool.command.CommandType;
import site.tidepool.datastructure.RedisBytes;
import site.tidepool.exception.CommandException;
import site.tidepool.protocol.Resp;
import site.tidepool.protocol.SimpleString;
import site.tidepool.server.context.RedisContext;

/**
 * FLUSHDB命令实现 - 清空键空间
 * 语法: FLUSHDB [ASYNC|SYNC]
 *
 * <p>两种模式都同步清空。正在等待的 BLPOP 客户端不受影响。
 *
 * @author tidepool
 * @since 1.0
 */
public class Flushdb implements Command {

    private final RedisContext redisContext;

    public Flushdb(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.FLUSHDB;
    }

    @Override
    public void setContext(final Resp[] array) {
        if (array.length > 1) {
            final RedisBytes mode = Arguments.bytes(array[1]);
            if (!mode.equalsIgnoreCase("ASYNC") && !mode.equalsIgnoreCase("SYNC")) {
                throw CommandException.syntaxError();
            }
        }
    }

    @Override
    public Resp handle() {
        redisContext.flushAll();
        return SimpleString.OK;
    }

    @Override
    public boolean isWriteCommand() {
        return true;
    }
}
