package site.tidepool.command.impl;

import site.tidepool.command.Arguments;
import site.tidepool.command.Command;
import site.tidepool.command.CommandType;
import site.tidepool.datastructure.RedisBytes;
import site.tidepool.protocol.BulkString;
import site.tidepool.protocol.Resp;

/**
 * ECHO命令实现 - 原样返回消息
 * 语法: ECHO message
 *
 * @author tidepool
 * @since 1.0
 */
public class Echo implements Command {

    private RedisBytes message;

    @Override
    public CommandType getType() {
        return CommandType.ECHO;
    }

    @Override
    public void setContext(final Resp[] array) {
        this.message = Arguments.bytes(array[1]);
    }

    @Override
    public Resp handle() {
        return BulkString.create(message);
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
