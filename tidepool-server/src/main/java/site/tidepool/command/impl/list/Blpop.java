package site.tidepool.command.impl.list;

import lombok.extern.slf4j.Slf4j;
import site.tidepool.blocking.Waiter;
import site.tidepool.command.Arguments;
import site.tidepool.command.Command;
import site.tidepool.command.CommandType;
import site.tidepool.command.SessionAware;
import site.tidepool.datastructure.RedisBytes;
import site.tidepool.datastructure.RedisList;
import site.tidepool.protocol.BulkString;
import site.tidepool.protocol.Resp;
import site.tidepool.protocol.RespArray;
import site.tidepool.server.context.RedisContext;
import site.tidepool.server.session.ClientSession;

/**
 * BLPOP命令实现 - 阻塞式左侧弹出
 * 语法: BLPOP key timeout
 *
 * <p>列表有元素时立即弹出并回复 [key, element]。否则把连接登记为等待者并返回null，
 * 由后续的推入命令或超时计时器写出回复；超时回复 nil 数组。timeout 为 0 表示永久等待。
 *
 * <p>没有连接的调用（程序内部执行）不能挂起，列表为空时直接回复 nil 数组。
 *
 * @author tidepool
 * @since 1.0
 */
@Slf4j
public class Blpop implements Command, SessionAware {

    private final RedisContext redisContext;
    private ClientSession session;
    private RedisBytes key;
    private long timeoutMillis;

    public Blpop(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.BLPOP;
    }

    @Override
    public void setSession(final ClientSession session) {
        this.session = session;
    }

    @Override
    public void setContext(final Resp[] array) {
        this.key = Arguments.bytes(array[1]);
        this.timeoutMillis = Arguments.parseTimeoutMillis(Arguments.bytes(array[2]));
    }

    @Override
    public Resp handle() {
        // 1. 类型检查先于阻塞
        final RedisList redisList = redisContext.getList(key);

        // 2. 有数据直接弹出
        if (redisList != null && !redisList.isEmpty()) {
            final RedisBytes value = redisList.lpop();
            if (redisList.isEmpty()) {
                redisContext.delete(key);
            }
            return RespArray.valueOf(new Resp[]{BulkString.create(key), BulkString.create(value)});
        }

        // 3. 没有连接无法挂起
        if (session == null) {
            return RespArray.NULL;
        }

        // 4. 挂起连接，回复由协调器写出
        final Waiter waiter = redisContext.getBlockingCoordinator().block(key, session, timeoutMillis);
        session.suspend(waiter);
        log.debug("BLPOP 挂起: key={}, timeout={}ms", key, timeoutMillis);
        return null;
    }

    @Override
    public boolean isWriteCommand() {
        return true;
    }
}
