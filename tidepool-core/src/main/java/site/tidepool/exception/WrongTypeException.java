package site.tidepool.exception;

/**
 * 键上保存的值类型与命令要求的类型不一致。
 */
public class WrongTypeException extends CommandException {

    public static final String MESSAGE = "WRONGTYPE Operation against a key holding the wrong kind of value";

    public WrongTypeException() {
        super(MESSAGE);
    }
}
