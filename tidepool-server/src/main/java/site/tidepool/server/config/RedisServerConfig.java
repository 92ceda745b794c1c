package site.tidepool.server.config;

import lombok.Builder;
import lombok.Data;
import site.tidepool.protocol.handler.RespDecoder;

/**
 * 服务器配置，统一管理网络、线程和协议限制参数。
 *
 * <p>使用 Builder 创建，未设置的字段使用默认值：
 * <pre>
 * RedisServerConfig config = RedisServerConfig.builder()
 *         .port(6380)
 *         .build();
 * </pre>
 *
 * @author tidepool
 * @since 1.0.0
 */
@Data
@Builder
public class RedisServerConfig {

    // ========== 网络配置 ==========

    /**
     * 服务器监听地址。
     *
     * <p>0.0.0.0 接受所有网卡上的连接，127.0.0.1 只允许本机访问。
     */
    @Builder.Default
    private String host = "0.0.0.0";

    /**
     * 服务器监听端口，0 表示由系统分配。
     */
    @Builder.Default
    private int port = 6379;

    /** TCP连接队列大小 */
    @Builder.Default
    private int backlogSize = 1024;

    /** 接收缓冲区大小（字节） */
    @Builder.Default
    private int receiveBufferSize = 32 * 1024;

    /** 发送缓冲区大小（字节） */
    @Builder.Default
    private int sendBufferSize = 32 * 1024;

    // ========== 线程配置 ==========

    /** Boss线程组大小（接受连接） */
    @Builder.Default
    private int bossThreadCount = 1;

    /**
     * Worker线程组大小（处理I/O），0 表示使用 Netty 的默认值（CPU核心数的2倍）。
     *
     * <p>命令始终在唯一的命令执行线程上串行执行，这个值只影响网络读写。
     */
    @Builder.Default
    private int workerThreadCount = 0;

    // ========== 协议限制 ==========

    /** 内联命令和长度行的最大字节数 */
    @Builder.Default
    private int maxInlineLength = RespDecoder.DEFAULT_MAX_INLINE_LENGTH;

    /** 单个批量字符串的最大字节数 */
    @Builder.Default
    private int maxBulkLength = RespDecoder.DEFAULT_MAX_BULK_LENGTH;

    /** 单个请求的最大参数个数 */
    @Builder.Default
    private int maxArrayLength = RespDecoder.DEFAULT_MAX_ARRAY_LENGTH;

    // ========== 调试 ==========

    /** 是否以调试模式运行，启动器据此打开 DEBUG 日志 */
    @Builder.Default
    private boolean debug = false;

    /**
     * 创建默认配置。
     *
     * @return 默认配置实例
     */
    public static RedisServerConfig defaultConfig() {
        return RedisServerConfig.builder().build();
    }

    /**
     * 验证配置参数的合法性
     *
     * @throws IllegalArgumentException 如果配置参数无效
     */
    public void validate() {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("端口号必须在0-65535范围内");
        }
        if (bossThreadCount <= 0 || workerThreadCount < 0) {
            throw new IllegalArgumentException("线程数量不合法");
        }
        if (backlogSize <= 0 || receiveBufferSize <= 0 || sendBufferSize <= 0) {
            throw new IllegalArgumentException("缓冲区大小必须大于0");
        }
        if (maxInlineLength <= 0 || maxBulkLength < 0 || maxArrayLength <= 0) {
            throw new IllegalArgumentException("协议限制必须大于0");
        }
    }
}
