package site.tidepool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import site.tidepool.server.TidepoolServer;
import site.tidepool.server.config.RedisServerConfig;

/**
 * 进程入口
 *
 * <p>用法: {@code tidepool [--port|-p <port>] [--debug|-d]}
 *
 * <p>--debug 在日志系统初始化之前设置 {@code tidepool.log.level=DEBUG}，
 * 所以这个类不能持有静态的 Logger。
 */
public class TidepoolLauncher {

    static final String LOG_LEVEL_PROPERTY = "tidepool.log.level";

    private static final String USAGE = "用法: tidepool [--port|-p <port>] [--debug|-d]";

    public static void main(final String[] args) {
        final RedisServerConfig config;
        try {
            config = parseArguments(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
            return;
        }
        if (config.isDebug()) {
            System.setProperty(LOG_LEVEL_PROPERTY, "DEBUG");
        }

        final Logger log = LoggerFactory.getLogger(TidepoolLauncher.class);
        final TidepoolServer server = new TidepoolServer(config);
        server.setShutdownAction(() -> new Thread(() -> System.exit(0), "tidepool-exit").start());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("正在关闭服务器...");
            server.stop();
        }, "tidepool-shutdown-hook"));

        try {
            server.start();
        } catch (IllegalStateException e) {
            log.error("服务器启动失败: {}", e.getMessage());
            System.exit(1);
        }
    }

    /**
     * 解析命令行参数。
     *
     * @throws IllegalArgumentException 参数不合法
     */
    static RedisServerConfig parseArguments(final String[] args) {
        final RedisServerConfig.RedisServerConfigBuilder builder = RedisServerConfig.builder();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--port":
                case "-p":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("缺少端口号");
                    }
                    builder.port(parsePort(args[++i]));
                    break;
                case "--debug":
                case "-d":
                    builder.debug(true);
                    break;
                default:
                    throw new IllegalArgumentException("未知参数: " + args[i]);
            }
        }
        return builder.build();
    }

    private static int parsePort(final String text) {
        final int port;
        try {
            port = Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("端口号不是整数: " + text, e);
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("端口号必须在0-65535范围内: " + text);
        }
        return port;
    }
}
