package site.tidepool.exception;

/**
 * 命令执行失败。
 *
 * <p>消息是完整的错误回复文本，包含类别前缀，例如 "ERR syntax error"。
 * 分发器把它原样转换成错误回复，连接保持可用。
 *
 * @author tidepool
 * @since 1.0.0
 */
public class CommandException extends RuntimeException {

    public CommandException(final String message) {
        super(message);
    }

    public static CommandException syntaxError() {
        return new CommandException("ERR syntax error");
    }

    public static CommandException notInteger() {
        return new CommandException("ERR value is not an integer or out of range");
    }

    public static CommandException notPositive() {
        return new CommandException("ERR value is out of range, must be positive");
    }

    public static CommandException invalidStreamId() {
        return new CommandException("ERR Invalid stream ID specified as stream command argument");
    }
}
