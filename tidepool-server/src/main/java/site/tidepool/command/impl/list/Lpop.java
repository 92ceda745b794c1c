package site.tidepool.command.impl.list;

import site.tidepool.command.Arguments;
import site.tidepool.command.Command;
import site.tidepool.command.CommandType;
import site.tidepool.datastructure.RedisBytes;
import site.tidepool.datastructure.RedisList;
import site.tidepool.exception.CommandException;
import site.tidepool.protocol.BulkString;
import site.tidepool.protocol.Resp;
import site.tidepool.protocol.RespArray;
import site.tidepool.server.context.RedisContext;

import java.util.List;

/**
 * LPOP命令实现 - 从列表头部弹出元素
 * 语法: LPOP key [count]
 *
 * <p>不带 count 时返回单个元素或 nil；带 count 时返回数组，键不存在时返回空数组。
 * 列表被弹空后删除键。
 *
 * @author tidepool
 * @since 1.0
 */
public class Lpop implements Command {

    private final RedisContext redisContext;
    private RedisBytes key;
    /** -1 表示没有 count 参数 */
    private long count = -1;

    public Lpop(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.LPOP;
    }

    @Override
    public void setContext(final Resp[] array) {
        this.key = Arguments.bytes(array[1]);
        if (array.length > 2) {
            this.count = Arguments.parseLong(Arguments.bytes(array[2]));
            if (count < 0) {
                throw CommandException.notPositive();
            }
        }
    }

    @Override
    public Resp handle() {
        final RedisList redisList = redisContext.getList(key);
        if (count < 0) {
            return popOne(redisList);
        }
        if (redisList == null) {
            return RespArray.EMPTY;
        }
        final List<RedisBytes> popped = redisList.lpop(count);
        removeIfEmpty(redisList);
        final Resp[] result = new Resp[popped.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = BulkString.create(popped.get(i));
        }
        return RespArray.valueOf(result);
    }

    private Resp popOne(final RedisList redisList) {
        if (redisList == null || redisList.isEmpty()) {
            return BulkString.NULL;
        }
        final RedisBytes value = redisList.lpop();
        removeIfEmpty(redisList);
        return BulkString.create(value);
    }

    private void removeIfEmpty(final RedisList redisList) {
        if (redisList.isEmpty()) {
            redisContext.delete(key);
        }
    }

    @Override
    public boolean isWriteCommand() {
        return true;
    }
}
