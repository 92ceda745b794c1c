package site.tidepool.command.impl.stream;

import lombok.extern.slf4j.Slf4j;
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
import site.tidepool.server.context.RedisContext;

import java.util.LinkedHashMap;

/**
 * XADD命令实现 - 向流追加一个条目
 * 语法: XADD key id field value [field value ...]
 *
 * <p>id 可以是 "*"、"ms-*" 或完整的 "ms-seq"，分配规则见
 * {@link site.tidepool.datastructure.StreamIdAllocator}。键不存在时创建流。
 *
 * @author tidepool
 * @since 1.0
 */
@Slf4j
public class Xadd implements Command {

    private final RedisContext redisContext;
    private RedisBytes key;
    private String requestedId;
    private LinkedHashMap<RedisBytes, RedisBytes> fields;

    public Xadd(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.XADD;
    }

    @Override
    public void setContext(final Resp[] array) {
        // 字段和值必须成对出现
        if ((array.length - 3) % 2 != 0) {
            throw new CommandException(
                    "ERR wrong number of arguments for '" + getType().lowerName() + "' command");
        }
        this.key = Arguments.bytes(array[1]);
        this.requestedId = Arguments.bytes(array[2]).getString();
        this.fields = new LinkedHashMap<>();
        for (int i = 3; i < array.length; i += 2) {
            fields.put(Arguments.bytes(array[i]), Arguments.bytes(array[i + 1]));
        }
    }

    @Override
    public Resp handle() {
        // 1. 类型检查
        RedisStream stream = redisContext.getStream(key);

        // 2. 分配ID，失败时不创建流
        final StreamId last = stream == null ? StreamId.MIN : stream.getLastId();
        final StreamId id = redisContext.getStreamIdAllocator().next(last, requestedId);

        // 3. 追加
        if (stream == null) {
            stream = new RedisStream();
            redisContext.put(key, stream);
        }
        stream.append(new StreamEntry(id, fields));
        log.trace("XADD {} {} 字段数={}", key, id, fields.size());
        return BulkString.fromString(id.toString());
    }

    @Override
    public boolean isWriteCommand() {
        return true;
    }
}
