package site.tidepool.server;

import site.tidepool.protocol.Resp;

/**
 * 服务器接口
 *
 * @author tidepool
 * @since 1.0
 */
public interface RedisServer {

    /**
     * 启动服务器并开始监听。
     *
     * @throws IllegalStateException 端口绑定失败
     */
    void start();

    /**
     * 停止服务器，释放所有线程。可以重复调用。
     */
    void stop();

    /**
     * 在命令执行线程上执行一个命令并等待结果，不经过网络。
     *
     * @param command 请求数组
     * @return 回复
     */
    Resp executeCommand(Resp command);

    /**
     * 实际监听的端口，配置端口为0时由系统分配。
     */
    int getPort();
}
