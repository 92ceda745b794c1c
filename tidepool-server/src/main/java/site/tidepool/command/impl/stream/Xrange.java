package site.tidepool.command.impl.stream;

import site.tidepool.command.Arguments;
import site.tidepool.command.Command;
import site.tidepool.command.CommandType;
import site.tidepool.datastructure.RedisBytes;
import site.tidepool.datastructure.RedisStream;
import site.tidepool.datastructure.StreamEntry;
import site.tidepool.datastructure.StreamId;
import site.tidepool.exception.CommandException;
import site.tidepool.protocol.BulkString;
import site.tidepool.protocol.Resp;
import site.tidepool.protocol.RespArray;
import site.tidepool.server.context.RedisContext;

import java.util.List;
import java.util.Map;

/**
 * XRANGE命令实现 - 按ID闭区间读取流条目
 * 语法: XRANGE key start end [COUNT n]
 *
 * <p>每个条目回复为 [id, [field, value, ...]]。
 *
 * @author tidepool
 * @since 1.0
 */
public class Xrange implements Command {

    private static final String COUNT = "COUNT";

    private final RedisContext redisContext;
    private RedisBytes key;
    private StreamId start;
    private StreamId end;
    /** -1 表示不限制 */
    private long count = -1;

    public Xrange(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.XRANGE;
    }

    @Override
    public void setContext(final Resp[] array) {
        this.key = Arguments.bytes(array[1]);
        this.start = StreamId.parseBound(Arguments.bytes(array[2]).getString(), false);
        this.end = StreamId.parseBound(Arguments.bytes(array[3]).getString(), true);
        if (array.length == 4) {
            return;
        }
        if (array.length != 6 || !Arguments.bytes(array[4]).equalsIgnoreCase(COUNT)) {
            throw CommandException.syntaxError();
        }
        final long parsed = Arguments.parseLong(Arguments.bytes(array[5]));
        // COUNT 小于等于0时结果为空
        this.count = Math.max(parsed, 0);
    }

    @Override
    public Resp handle() {
        final RedisStream stream = redisContext.getStream(key);
        if (stream == null || count == 0) {
            return RespArray.EMPTY;
        }
        final List<StreamEntry> entries = stream.range(start, end, count);
        final Resp[] result = new Resp[entries.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = toResp(entries.get(i));
        }
        return RespArray.valueOf(result);
    }

    private static Resp toResp(final StreamEntry entry) {
        final Resp[] flat = new Resp[entry.getFields().size() * 2];
        int i = 0;
        for (final Map.Entry<RedisBytes, RedisBytes> field : entry.getFields().entrySet()) {
            flat[i++] = BulkString.create(field.getKey());
            flat[i++] = BulkString.create(field.getValue());
        }
        return RespArray.valueOf(new Resp[]{
                BulkString.fromString(entry.getId().toString()),
                RespArray.valueOf(flat)
        });
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
