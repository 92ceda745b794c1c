package site.tidepool.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.util.CharsetUtil;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RespArrayTest {

    private static String encode(final Resp resp) {
        final ByteBuf buf = Unpooled.buffer();
        try {
            resp.encode(resp, buf);
            return buf.toString(CharsetUtil.UTF_8);
        } finally {
            buf.release();
        }
    }

    @Test
    public void testNullAndEmpty() {
        assertEquals("*-1\r\n", encode(RespArray.NULL));
        assertEquals("*0\r\n", encode(RespArray.EMPTY));
        assertSame(RespArray.NULL, RespArray.valueOf((Resp[]) null));
        assertSame(RespArray.EMPTY, RespArray.valueOf(new Resp[0]));
        assertTrue(RespArray.NULL.isNull());
    }

    @Test
    public void testMixedElements() {
        final RespArray array = RespArray.valueOf(List.of(
                BulkString.fromString("mylist"),
                BulkString.fromString("foo")));

        assertEquals("*2\r\n$6\r\nmylist\r\n$3\r\nfoo\r\n", encode(array));
        assertEquals(2, array.size());

        final RespArray mixed = new RespArray(new Resp[]{
                SimpleString.OK, RespInteger.valueOf(-3), BulkString.NULL, new Errors("ERR x")});
        assertEquals("*4\r\n+OK\r\n:-3\r\n$-1\r\n-ERR x\r\n", encode(mixed));
    }

    @Test
    public void testNestedArrays() {
        // 流条目的形式：[ID, [field, value]]
        final RespArray entry = new RespArray(new Resp[]{
                BulkString.fromString("1526985054069-0"),
                new RespArray(new Resp[]{BulkString.fromString("temperature"), BulkString.fromString("36")})});
        final RespArray reply = new RespArray(new Resp[]{entry});

        assertEquals("*1\r\n*2\r\n$15\r\n1526985054069-0\r\n*2\r\n$11\r\ntemperature\r\n$2\r\n36\r\n",
                encode(reply));
    }
}
