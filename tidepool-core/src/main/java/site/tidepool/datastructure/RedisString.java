package site.tidepool.datastructure;

import lombok.Getter;
import lombok.Setter;

/**
 * 字符串值，二进制安全。
 */
@Getter
@Setter
public class RedisString implements RedisData {

    private RedisBytes value;

    public RedisString(final RedisBytes value) {
        this.value = value;
    }

    @Override
    public String getTypeName() {
        return "string";
    }
}
