package site.tidepool.protocol;

/**
 * 请求帧格式错误。连接收到它之后不能再继续解析，只能回一个错误然后关闭。
 */
public class RespProtocolException extends RuntimeException {

    public RespProtocolException(final String message) {
        super(message);
    }
}
