package site.tidepool.command.impl.set;

import site.tidepool.command.Arguments;
import site.tidepool.command.Command;
import site.tidepool.command.CommandType;
import site.tidepool.datastructure.RedisBytes;
import site.tidepool.datastructure.RedisSet;
import site.tidepool.protocol.BulkString;
import site.tidepool.protocol.Resp;
import site.tidepool.protocol.RespArray;
import site.tidepool.protocol.RespInteger;
import site.tidepool.server.context.RedisContext;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 集合运算命令：SINTER、SUNION、SDIFF 以及对应的 STORE 形式。
 *
 * <p>语法: SINTER key [key ...] / SINTERSTORE destination key [key ...]
 *
 * <p>不存在的键按空集处理，结果保持首次出现的顺序。STORE 形式用结果覆盖目标键，
 * 结果为空时删除目标键，回复结果的元素个数。
 *
 * @author tidepool
 * @since 1.0
 */
public class SetAlgebra implements Command {

    public enum Operation {
        INTER,
        UNION,
        DIFF
    }

    private final RedisContext redisContext;
    private final CommandType type;
    private final Operation operation;
    private final boolean store;

    private RedisBytes destination;
    private List<RedisBytes> keys;

    public SetAlgebra(final RedisContext redisContext, final CommandType type,
                      final Operation operation, final boolean store) {
        this.redisContext = redisContext;
        this.type = type;
        this.operation = operation;
        this.store = store;
    }

    @Override
    public CommandType getType() {
        return type;
    }

    @Override
    public void setContext(final Resp[] array) {
        if (store) {
            this.destination = Arguments.bytes(array[1]);
            this.keys = Arguments.rest(array, 2);
        } else {
            this.keys = Arguments.rest(array, 1);
        }
    }

    @Override
    public Resp handle() {
        // 1. 先读取全部集合，任何一个类型不对都在修改之前失败
        final List<Set<RedisBytes>> sets = new ArrayList<>(keys.size());
        for (final RedisBytes key : keys) {
            final RedisSet redisSet = redisContext.getSet(key);
            sets.add(redisSet == null ? Collections.emptySet() : redisSet.view());
        }

        // 2. 计算
        final Set<RedisBytes> result = compute(sets);
        if (!store) {
            return toArray(result);
        }

        // 3. 写入目标键
        if (result.isEmpty()) {
            redisContext.delete(destination);
        } else {
            redisContext.put(destination, new RedisSet(result));
        }
        return RespInteger.valueOf(result.size());
    }

    private Set<RedisBytes> compute(final List<Set<RedisBytes>> sets) {
        final Set<RedisBytes> result = new LinkedHashSet<>(sets.get(0));
        for (int i = 1; i < sets.size(); i++) {
            final Set<RedisBytes> other = sets.get(i);
            switch (operation) {
                case INTER:
                    result.retainAll(other);
                    break;
                case UNION:
                    result.addAll(other);
                    break;
                case DIFF:
                default:
                    result.removeAll(other);
                    break;
            }
        }
        return result;
    }

    static RespArray toArray(final Collection<RedisBytes> members) {
        final Resp[] result = new Resp[members.size()];
        int i = 0;
        for (final RedisBytes member : members) {
            result[i++] = BulkString.create(member);
        }
        return RespArray.valueOf(result);
    }

    @Override
    public boolean isWriteCommand() {
        return store;
    }
}
