package site.tidepool.command.impl;

import site.tidepool.command.Command;
import site.tidepool.command.CommandType;
import site.tidepool.protocol.Resp;
import site.tidepool.protocol.SimpleString;

/**
 * PING命令实现
 * 语法: PING
 *
 * @author tidepool
 * @since 1.0
 */
public class Ping implements Command {

    @Override
    public CommandType getType() {
        return CommandType.PING;
    }

    @Override
    public void setContext(final Resp[] array) {
        // 无参数
    }

    @Override
    public Resp handle() {
        return SimpleString.PONG;
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
