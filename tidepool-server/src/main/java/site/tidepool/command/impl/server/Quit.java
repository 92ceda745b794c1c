package site.tidepool.command.impl.server;

import site.tidepool.command.Command;
import site.tidepool.command.CommandType;
import site.tidepool.command.SessionAware;
import site.tidepool.protocol.Resp;
import site.tidepool.protocol.SimpleString;
import site.tidepool.server.session.ClientSession;

/**
 * QUIT命令实现 - 回复 OK 后关闭连接
 * 语法: QUIT
 */
public class Quit implements Command, SessionAware {

    private ClientSession session;

    @Override
    public CommandType getType() {
        return CommandType.QUIT;
    }

    @Override
    public void setSession(final ClientSession session) {
        this.session = session;
    }

    @Override
    public void setContext(final Resp[] array) {
        // 无参数
    }

    @Override
    public Resp handle() {
        if (session != null) {
            session.closeAfterReply();
        }
        return SimpleString.OK;
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
