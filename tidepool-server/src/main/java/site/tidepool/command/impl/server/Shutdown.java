package site.tidepool.command.impl.server;

import site.tidepool.command.Arguments;
import site.tidepool.command.Command;
import site.tidepool.command.CommandType;
import site.tidepool.datastructure.RedisBytes;
import site.tidepool.exception.CommandException;
import site.tidepool.protocol.Resp;
import site.tidepool.server.context.RedisContext;

/**
 * SHUTDOWN命令实现 - 关闭服务器进程，不回复
 * 语法: SHUTDOWN [NOSAVE|SAVE]
 *
 * <p>没有持久化，修饰参数只做校验。
 *
 * @author tidepool
 * @since 1.0
 */
public class Shutdown implements Command {

    private final RedisContext redisContext;

    public Shutdown(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.SHUTDOWN;
    }

    @Override
    public void setContext(final Resp[] array) {
        if (array.length > 1) {
            final RedisBytes modifier = Arguments.bytes(array[1]);
            if (!modifier.equalsIgnoreCase("NOSAVE") && !modifier.equalsIgnoreCase("SAVE")) {
                throw CommandException.syntaxError();
            }
        }
    }

    @Override
    public Resp handle() {
        redisContext.requestShutdown();
        return null;
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
