package site.tidepool.blocking;

import lombok.extern.slf4j.Slf4j;
import site.tidepool.datastructure.RedisBytes;
import site.tidepool.datastructure.RedisList;
import site.tidepool.protocol.BulkString;
import site.tidepool.protocol.Resp;
import site.tidepool.protocol.RespArray;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 阻塞弹出协调器
 *
 * <p>为每个键维护一个先进先出的等待队列。列表被推入数据后，推入命令调用
 * {@link #serve(RedisBytes, RedisList)}，按登记顺序一人一个元素地唤醒等待者，
 * 直到元素或等待者耗尽。
 *
 * <p>超时计时器提交到构造时传入的调度器上。服务端传入的就是命令执行线程本身，
 * 所以推入和超时都是同一个线程上的任务，先执行的一方决定结果，等待者只会得到一个结果。
 *
 * <p>本类不是线程安全的，只能在命令执行线程上调用。
 *
 * @author tidepool
 * @since 1.0.0
 */
@Slf4j
public class BlockingCoordinator {

    private final ScheduledExecutorService scheduler;

    private final Map<RedisBytes, ArrayDeque<Waiter>> waiters = new HashMap<>();

    public BlockingCoordinator(final ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * 登记一个等待者。
     *
     * @param key 等待的键
     * @param client 被挂起的客户端
     * @param timeoutMillis 超时毫秒数，0表示永久等待
     * @return 等待者，客户端断开时用它取消
     */
    public Waiter block(final RedisBytes key, final BlockedClient client, final long timeoutMillis) {
        final Waiter waiter = new Waiter(key, client);
        waiters.computeIfAbsent(key, k -> new ArrayDeque<>()).addLast(waiter);
        if (timeoutMillis > 0) {
            waiter.setTimeoutFuture(scheduler.schedule(() -> expire(waiter), timeoutMillis, TimeUnit.MILLISECONDS));
        }
        log.debug("登记阻塞等待: key={}, timeout={}ms, 队列长度={}", key.getString(), timeoutMillis, waiterCount(key));
        return waiter;
    }

    /**
     * 用列表中的元素唤醒等待者，从列表头部取元素，从队列头部取等待者。
     *
     * @param key 刚被推入数据的键
     * @param list 该键上的列表
     * @return 被唤醒的等待者数量
     */
    public int serve(final RedisBytes key, final RedisList list) {
        final ArrayDeque<Waiter> queue = waiters.get(key);
        if (queue == null) {
            return 0;
        }
        int served = 0;
        while (!queue.isEmpty() && !list.isEmpty()) {
            final Waiter waiter = queue.pollFirst();
            if (!waiter.finish()) {
                continue;
            }
            final RedisBytes element = list.lpop();
            served++;
            waiter.getClient().wake(new RespArray(new Resp[]{new BulkString(key), new BulkString(element)}));
        }
        removeIfEmpty(key, queue);
        if (served > 0) {
            log.debug("唤醒 {} 个等待者: key={}, 剩余等待者={}", served, key.getString(), waiterCount(key));
        }
        return served;
    }

    /**
     * 取消等待，不产生任何回复。用于客户端断开。
     *
     * @param waiter 要取消的等待者
     */
    public void cancel(final Waiter waiter) {
        if (!waiter.finish()) {
            return;
        }
        dequeue(waiter);
        log.debug("取消阻塞等待: key={}", waiter.getKey().getString());
    }

    /**
     * 某个键上还在等待的客户端数量。
     */
    public int waiterCount(final RedisBytes key) {
        final ArrayDeque<Waiter> queue = waiters.get(key);
        return queue == null ? 0 : queue.size();
    }

    public boolean hasWaiters(final RedisBytes key) {
        return waiterCount(key) > 0;
    }

    private void expire(final Waiter waiter) {
        if (!waiter.finish()) {
            // 已经被推入唤醒或已取消
            return;
        }
        dequeue(waiter);
        log.debug("阻塞等待超时: key={}", waiter.getKey().getString());
        waiter.getClient().wake(RespArray.NULL);
    }

    private void dequeue(final Waiter waiter) {
        final ArrayDeque<Waiter> queue = waiters.get(waiter.getKey());
        if (queue != null) {
            queue.remove(waiter);
            removeIfEmpty(waiter.getKey(), queue);
        }
    }

    private void removeIfEmpty(final RedisBytes key, final ArrayDeque<Waiter> queue) {
        if (queue.isEmpty()) {
            waiters.remove(key, queue);
        }
    }
}
