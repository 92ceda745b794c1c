package site.tidepool.command;

import site.tidepool.server.session.ClientSession;

/**
 * 需要访问发起请求的连接的命令，例如 BLPOP 和 QUIT。
 *
 * <p>通过 {@link site.tidepool.server.TidepoolServer#executeCommand} 执行时没有连接，
 * 此时不会调用 {@link #setSession(ClientSession)}。
 */
public interface SessionAware {

    void setSession(ClientSession session);
}
