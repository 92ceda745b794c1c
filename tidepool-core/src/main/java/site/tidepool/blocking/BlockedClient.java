package site.tidepool.blocking;

import site.tidepool.protocol.Resp;

/**
 * 被阻塞命令挂起的客户端。
 */
public interface BlockedClient {

    /**
     * 唤醒客户端并发送阻塞命令的最终回复。在命令执行线程上调用，每个等待者最多调用一次。
     *
     * @param reply 取到的数据，或者超时时的空值数组
     */
    void wake(Resp reply);
}
