package site.tidepool.datastructure;

/**
 * 数据结构基础接口
 *
 * <p>所有值类型（String、List、Set、Stream）都实现此接口。
 * 值只会在命令执行线程上被读写，实现类不做同步。
 *
 * @author tidepool
 * @since 1.0.0
 */
public interface RedisData {

    /**
     * TYPE 命令返回的类型名，例如 "string"、"list"。
     *
     * @return 类型名
     */
    String getTypeName();
}
