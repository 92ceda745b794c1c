package site.tidepool.command;

import lombok.Getter;
import site.tidepool.command.impl.Echo;
import site.tidepool.command.impl.Ping;
import site.tidepool.command.impl.key.Del;
import site.tidepool.command.impl.key.Exists;
import site.tidepool.command.impl.key.Type;
import site.tidepool.command.impl.list.Blpop;
import site.tidepool.command.impl.list.Llen;
import site.tidepool.command.impl.list.Lpop;
import site.tidepool.command.impl.list.Lpush;
import site.tidepool.command.impl.list.Lrange;
import site.tidepool.command.impl.list.Rpush;
import site.tidepool.command.impl.server.Flushdb;
import site.tidepool.command.impl.server.Quit;
import site.tidepool.command.impl.server.Shutdown;
import site.tidepool.command.impl.set.Sadd;
import site.tidepool.command.impl.set.Scard;
import site.tidepool.command.impl.set.SetAlgebra;
import site.tidepool.command.impl.set.Sismember;
import site.tidepool.command.impl.set.Smembers;
import site.tidepool.command.impl.set.Srem;
import site.tidepool.command.impl.stream.Xadd;
import site.tidepool.command.impl.stream.Xrange;
import site.tidepool.command.impl.string.Get;
import site.tidepool.command.impl.string.Incr;
import site.tidepool.command.impl.string.Set;
import site.tidepool.datastructure.RedisBytes;
import site.tidepool.server.context.RedisContext;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 命令表
 *
 * <p>每个枚举值声明命令名和参数个数范围（不含命令名本身，-1 表示不限上限），
 * 并通过 {@link #createCommand(RedisContext)} 创建命令实例。
 * 查找时命令名大小写不敏感。
 *
 * @author tidepool
 * @since 1.0
 */
@Getter
public enum CommandType {

    // ========== 连接命令 ==========
    /** PING命令：测试服务器连接 */
    PING("PING", 0, 0),
    /** ECHO命令：原样返回参数 */
    ECHO("ECHO", 1, 1),
    /** QUIT命令：回复后关闭连接 */
    QUIT("QUIT", 0, 0),

    // ========== 键命令 ==========
    /** TYPE命令：获取键的数据类型 */
    TYPE("TYPE", 1, 1),
    /** EXISTS命令：统计存在的键 */
    EXISTS("EXISTS", 1, -1),
    /** DEL命令：删除键 */
    DEL("DEL", 1, -1),

    // ========== 字符串命令 ==========
    /** SET命令：设置键值对 */
    SET("SET", 2, 2),
    /** GET命令：获取键值 */
    GET("GET", 1, 1),
    /** INCR命令：将键值加1 */
    INCR("INCR", 1, 1),

    // ========== 列表命令 ==========
    /** RPUSH命令：右侧插入列表 */
    RPUSH("RPUSH", 2, -1),
    /** LPUSH命令：左侧插入列表 */
    LPUSH("LPUSH", 2, -1),
    /** LLEN命令：获取列表长度 */
    LLEN("LLEN", 1, 1),
    /** LRANGE命令：获取列表范围 */
    LRANGE("LRANGE", 3, 3),
    /** LPOP命令：左侧弹出列表 */
    LPOP("LPOP", 1, 2),
    /** BLPOP命令：阻塞式左侧弹出 */
    BLPOP("BLPOP", 2, 2),

    // ========== 集合命令 ==========
    /** SADD命令：添加集合成员 */
    SADD("SADD", 2, -1),
    /** SREM命令：移除指定集合成员 */
    SREM("SREM", 2, -1),
    /** SCARD命令：获取集合成员数 */
    SCARD("SCARD", 1, 1),
    /** SMEMBERS命令：获取全部成员 */
    SMEMBERS("SMEMBERS", 1, 1),
    /** SISMEMBER命令：判断成员是否存在 */
    SISMEMBER("SISMEMBER", 2, 2),
    SINTER("SINTER", 1, -1),
    SUNION("SUNION", 1, -1),
    SDIFF("SDIFF", 1, -1),
    SINTERSTORE("SINTERSTORE", 2, -1),
    SUNIONSTORE("SUNIONSTORE", 2, -1),
    SDIFFSTORE("SDIFFSTORE", 2, -1),

    // ========== 流命令 ==========
    /** XADD命令：追加流条目 */
    XADD("XADD", 4, -1),
    /** XRANGE命令：按ID范围读取流条目 */
    XRANGE("XRANGE", 3, 5),

    // ========== 服务器命令 ==========
    /** FLUSHDB命令：清空键空间 */
    FLUSHDB("FLUSHDB", 0, 1),
    /** SHUTDOWN命令：终止进程 */
    SHUTDOWN("SHUTDOWN", 0, 1);

    private static final Map<RedisBytes, CommandType> COMMAND_CACHE = new HashMap<>();

    static {
        for (final CommandType type : CommandType.values()) {
            COMMAND_CACHE.put(type.commandBytes, type);
        }
    }

    private final RedisBytes commandBytes;

    private final int minArgs;

    private final int maxArgs;

    CommandType(final String commandName, final int minArgs, final int maxArgs) {
        this.commandBytes = RedisBytes.fromString(commandName);
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
    }

    /**
     * 根据命令名查找，大小写不敏感。
     *
     * @param commandBytes 命令名
     * @return 命令类型，不存在时返回null
     */
    public static CommandType findByBytes(final RedisBytes commandBytes) {
        if (commandBytes == null) {
            return null;
        }
        // 1. 客户端通常发送大写命令名，直接命中
        final CommandType result = COMMAND_CACHE.get(commandBytes);
        if (result != null) {
            return result;
        }
        // 2. 转成大写再查
        return COMMAND_CACHE.get(RedisBytes.fromString(commandBytes.getString().toUpperCase(Locale.ROOT)));
    }

    /**
     * 参数个数是否在声明的范围内。
     *
     * @param argc 参数个数，不含命令名
     */
    public boolean acceptsArgumentCount(final int argc) {
        return argc >= minArgs && (maxArgs < 0 || argc <= maxArgs);
    }

    /**
     * 小写命令名，用于错误信息。
     */
    public String lowerName() {
        return commandBytes.getString().toLowerCase(Locale.ROOT);
    }

    /**
     * 创建命令实例。
     *
     * @param context 服务器上下文
     * @return 新的命令实例
     */
    public Command createCommand(final RedisContext context) {
        switch (this) {
            case PING:
                return new Ping();
            case ECHO:
                return new Echo();
            case QUIT:
                return new Quit();
            case TYPE:
                return new Type(context);
            case EXISTS:
                return new Exists(context);
            case DEL:
                return new Del(context);
            case SET:
                return new Set(context);
            case GET:
                return new Get(context);
            case INCR:
                return new Incr(context);
            case RPUSH:
                return new Rpush(context);
            case LPUSH:
                return new Lpush(context);
            case LLEN:
                return new Llen(context);
            case LRANGE:
                return new Lrange(context);
            case LPOP:
                return new Lpop(context);
            case BLPOP:
                return new Blpop(context);
            case SADD:
                return new Sadd(context);
            case SREM:
                return new Srem(context);
            case SCARD:
                return new Scard(context);
            case SMEMBERS:
                return new Smembers(context);
            case SISMEMBER:
                return new Sismember(context);
            case SINTER:
                return new SetAlgebra(context, this, SetAlgebra.Operation.INTER, false);
            case SUNION:
                return new SetAlgebra(context, this, SetAlgebra.Operation.UNION, false);
            case SDIFF:
                return new SetAlgebra(context, this, SetAlgebra.Operation.DIFF, false);
            case SINTERSTORE:
                return new SetAlgebra(context, this, SetAlgebra.Operation.INTER, true);
            case SUNIONSTORE:
                return new SetAlgebra(context, this, SetAlgebra.Operation.UNION, true);
            case SDIFFSTORE:
                return new SetAlgebra(context, this, SetAlgebra.Operation.DIFF, true);
            case XADD:
                return new Xadd(context);
            case XRANGE:
                return new Xrange(context);
            case FLUSHDB:
                return new Flushdb(context);
            case SHUTDOWN:
                return new Shutdown(context);
            default:
                throw new IllegalStateException("未实现的命令: " + this);
        }
    }
}
