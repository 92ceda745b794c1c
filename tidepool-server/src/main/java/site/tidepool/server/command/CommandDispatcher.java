package site.tidepool.server.command;

import lombok.extern.slf4j.Slf4j;
import site.tidepool.command.Command;
import site.tidepool.command.CommandType;
import site.tidepool.command.SessionAware;
import site.tidepool.datastructure.RedisBytes;
import site.tidepool.exception.CommandException;
import site.tidepool.protocol.BulkString;
import site.tidepool.protocol.Errors;
import site.tidepool.protocol.Resp;
import site.tidepool.protocol.RespArray;
import site.tidepool.server.context.RedisContext;
import site.tidepool.server.session.ClientSession;

/**
 * 命令分发器，负责把一个请求数组变成一个回复。
 *
 * <p>处理流程：
 * <ul>
 *   <li>校验参数都是非空的批量字符串
 *   <li>按命令名查表，未知命令回复错误
 *   <li>按命令表声明的范围校验参数个数
 *   <li>创建命令、解析参数并执行
 * </ul>
 *
 * <p>命令抛出的 {@link CommandException} 转换为错误回复，连接保持可用；
 * 其他运行时异常记录日志后同样转换为错误回复。
 *
 * <p>只能在命令执行线程上调用。
 *
 * @author tidepool
 * @since 1.0
 */
@Slf4j
public class CommandDispatcher {

    private final RedisContext redisContext;

    public CommandDispatcher(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    /**
     * 执行一个请求。
     *
     * @param request 请求数组，第一个元素是命令名
     * @param session 发起请求的连接，程序内部执行时为null
     * @return 回复；返回null表示此刻不回复
     */
    public Resp dispatch(final RespArray request, final ClientSession session) {
        final Resp[] array = request.getContent();
        if (array == null || array.length == 0) {
            return new Errors("ERR Protocol error: empty request");
        }

        // 1. 参数校验
        for (final Resp element : array) {
            if (!(element instanceof BulkString) || ((BulkString) element).isNull()) {
                return new Errors("ERR Protocol error: invalid null bulk argument");
            }
        }

        // 2. 查找命令
        final RedisBytes commandName = ((BulkString) array[0]).getContent();
        final CommandType commandType = CommandType.findByBytes(commandName);
        if (commandType == null) {
            log.debug("未知命令: {}", commandName.getString());
            return new Errors("ERR unknown command '" + commandName.getString() + "'");
        }

        // 3. 校验参数个数
        if (!commandType.acceptsArgumentCount(array.length - 1)) {
            return new Errors("ERR wrong number of arguments for '" + commandType.lowerName() + "' command");
        }

        // 4. 创建并执行命令
        final Command command = commandType.createCommand(redisContext);
        try {
            if (session != null && command instanceof SessionAware) {
                ((SessionAware) command).setSession(session);
            }
            command.setContext(array);
            final Resp result = command.handle();
            if (log.isDebugEnabled()) {
                if (command.isWriteCommand()) {
                    log.debug("执行命令 {} 参数个数={} 键数量={}", commandType, array.length - 1,
                            redisContext.getRedisCore().size());
                } else {
                    log.debug("执行命令 {} 参数个数={}", commandType, array.length - 1);
                }
            }
            return result;
        } catch (CommandException e) {
            log.debug("命令 {} 执行失败: {}", commandType, e.getMessage());
            return new Errors(e.getMessage());
        } catch (RuntimeException e) {
            log.error("命令 {} 执行异常", commandType, e);
            return new Errors("ERR " + e.getMessage());
        }
    }
}
