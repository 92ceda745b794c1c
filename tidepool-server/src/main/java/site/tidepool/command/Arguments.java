package site.tidepool.command;

import site.tidepool.datastructure.RedisBytes;
import site.tidepool.exception.CommandException;
import site.tidepool.protocol.BulkString;
import site.tidepool.protocol.Resp;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 参数解析工具。
 */
public final class Arguments {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private Arguments() {
    }

    public static RedisBytes bytes(final Resp resp) {
        return ((BulkString) resp).getContent();
    }

    /**
     * 取 array[from] 到末尾的所有参数。
     */
    public static List<RedisBytes> rest(final Resp[] array, final int from) {
        final List<RedisBytes> values = new ArrayList<>(array.length - from);
        for (int i = from; i < array.length; i++) {
            values.add(bytes(array[i]));
        }
        return values;
    }

    /**
     * 严格解析有符号64位整数：可选负号加数字，不允许前导零、正号和空白。
     *
     * @throws CommandException 不是合法整数或溢出
     */
    public static long parseLong(final RedisBytes value) {
        final String text = value.getString();
        final int length = text.length();
        final int digitsStart = length > 0 && text.charAt(0) == '-' ? 1 : 0;
        if (length == digitsStart || length > 20) {
            throw CommandException.notInteger();
        }
        if (text.charAt(digitsStart) == '0' && (length > digitsStart + 1 || digitsStart == 1)) {
            throw CommandException.notInteger();
        }
        for (int i = digitsStart; i < length; i++) {
            final char c = text.charAt(i);
            if (c < '0' || c > '9') {
                throw CommandException.notInteger();
            }
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw CommandException.notInteger();
        }
    }

    /**
     * 解析以秒为单位、可以带小数的超时参数。
     *
     * @return 超时毫秒数，0表示永久等待
     * @throws CommandException 不是数字或为负数
     */
    public static long parseTimeoutMillis(final RedisBytes value) {
        final String text = value.getString();
        if (!DECIMAL.matcher(text).matches()) {
            throw new CommandException("ERR timeout is not a float or out of range");
        }
        final double seconds = Double.parseDouble(text);
        if (Double.isInfinite(seconds) || seconds * 1000 > Long.MAX_VALUE) {
            throw new CommandException("ERR timeout is not a float or out of range");
        }
        if (seconds < 0) {
            throw new CommandException("ERR timeout is negative");
        }
        final long millis = Math.round(seconds * 1000);
        // 不足1毫秒的正数超时按1毫秒处理
        return millis == 0 && seconds > 0 ? 1 : millis;
    }
}
