package site.tidepool.blocking;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import site.tidepool.datastructure.RedisBytes;

import java.util.concurrent.ScheduledFuture;

/**
 * 一次阻塞弹出的登记信息。
 *
 * <p>pending 从 true 变成 false 只发生一次，之后到达的推入或超时都会忽略它。
 */
@Getter
public class Waiter {

    private final RedisBytes key;

    private final BlockedClient client;

    private boolean pending = true;

    @Setter(AccessLevel.PACKAGE)
    private ScheduledFuture<?> timeoutFuture;

    Waiter(final RedisBytes key, final BlockedClient client) {
        this.key = key;
        this.client = client;
    }

    /**
     * 结束等待并取消计时器。
     *
     * @return 本次调用是否真正结束了等待
     */
    boolean finish() {
        if (!pending) {
            return false;
        }
        pending = false;
        if (timeoutFuture != null) {
            timeoutFuture.cancel(false);
        }
        return true;
    }
}
