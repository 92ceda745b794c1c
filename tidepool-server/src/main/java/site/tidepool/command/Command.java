package site.tidepool.command;

import site.tidepool.exception.CommandException;
import site.tidepool.protocol.Resp;

/**
 * 命令接口
 *
 * <p>每次请求创建一个新实例：先由 {@link #setContext(Resp[])} 解析参数，
 * 再由 {@link #handle()} 在命令执行线程上执行。参数个数已经由分发器按
 * {@link CommandType} 的声明校验过，实现类只需要检查参数内容。
 *
 * @author tidepool
 * @since 1.0
 */
public interface Command {

    /**
     * 获取命令类型。
     *
     * @return 命令类型枚举值
     */
    CommandType getType();

    /**
     * 解析参数。array[0] 是命令名本身。
     *
     * @param array 请求数组，元素都是非空的 BulkString
     * @throws CommandException 参数内容不合法
     */
    void setContext(Resp[] array);

    /**
     * 执行命令。
     *
     * @return 回复；返回null表示此刻不回复（阻塞中的 BLPOP、SHUTDOWN）
     * @throws CommandException 命令失败，转换为错误回复
     */
    Resp handle();

    /**
     * 是否会修改键空间，用于调试日志。
     */
    boolean isWriteCommand();
}
