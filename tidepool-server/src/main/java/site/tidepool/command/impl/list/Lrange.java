package site.tidepool.command.impl.list;

import site.tidepool.command.Arguments;
import site.tidepool.command.Command;
import site.tidepool.command.CommandType;
import site.tidepool.datastructure.RedisBytes;
import site.tidepool.datastructure.RedisList;
import site.tidepool.protocol.BulkString;
import site.tidepool.protocol.Resp;
import site.tidepool.protocol.RespArray;
import site.tidepool.server.context.RedisContext;

import java.util.ArrayList;
import java.util.List;

/**
 * LRANGE命令实现 - 获取闭区间内的元素，负数下标从尾部计数
 * 语法: LRANGE key start stop
 *
 * @author tidepool
 * @since 1.0
 */
public class Lrange implements Command {

    private final RedisContext redisContext;
    private RedisBytes key;
    private long start;
    private long stop;

    public Lrange(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.LRANGE;
    }

    @Override
    public void setContext(final Resp[] array) {
        this.key = Arguments.bytes(array[1]);
        this.start = Arguments.parseLong(Arguments.bytes(array[2]));
        this.stop = Arguments.parseLong(Arguments.bytes(array[3]));
    }

    @Override
    public Resp handle() {
        final RedisList redisList = redisContext.getList(key);
        if (redisList == null) {
            return RespArray.EMPTY;
        }
        final List<BulkString> result = new ArrayList<>();
        for (final RedisBytes value : redisList.lrange(start, stop)) {
            result.add(BulkString.create(value));
        }
        return RespArray.valueOf(result);
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
