package site.tidepool.server.command;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import site.tidepool.blocking.BlockingCoordinator;
import site.tidepool.core.RedisCore;
import site.tidepool.core.RedisCoreImpl;
import site.tidepool.datastructure.StreamIdAllocator;
import site.tidepool.protocol.BulkString;
import site.tidepool.protocol.Resp;
import site.tidepool.protocol.RespArray;
import site.tidepool.server.context.RedisContextImpl;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * 分发器测试，不经过网络，直接比较编码后的回复。
 */
@DisplayName("CommandDispatcher命令测试")
class CommandDispatcherTest {

    @Mock
    private ScheduledExecutorService scheduler;

    @Mock
    private Runnable shutdownAction;

    private final AtomicLong clock = new AtomicLong(1000);

    private RedisCore redisCore;
    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        redisCore = new RedisCoreImpl();
        final RedisContextImpl context = new RedisContextImpl(redisCore, new BlockingCoordinator(scheduler),
                new StreamIdAllocator(clock::get), shutdownAction);
        dispatcher = new CommandDispatcher(context);
    }

    private Resp dispatch(final String... args) {
        final Resp[] request = new Resp[args.length];
        for (int i = 0; i < args.length; i++) {
            request[i] = BulkString.fromString(args[i]);
        }
        return dispatcher.dispatch(new RespArray(request), null);
    }

    /** 执行命令并返回编码后的回复文本 */
    private String run(final String... args) {
        final Resp reply = dispatch(args);
        if (reply == null) {
            return null;
        }
        final ByteBuf buf = Unpooled.buffer();
        try {
            reply.encode(reply, buf);
            return buf.toString(StandardCharsets.UTF_8);
        } finally {
            buf.release();
        }
    }

    @Nested
    @DisplayName("分发")
    class Dispatch {

        @Test
        void unknownCommand() {
            assertThat(run("FOO", "bar")).isEqualTo("-ERR unknown command 'FOO'\r\n");
        }

        @Test
        void unknownCommandWithLineBreaksIsOneReply() {
            final String reply = run("foo\r\n:42");

            assertThat(reply).isEqualTo("-ERR unknown command 'foo  :42'\r\n");
            assertThat(reply.indexOf("\r\n")).isEqualTo(reply.length() - 2);
        }

        @Test
        void wrongArgumentCount() {
            assertThat(run("GET")).isEqualTo("-ERR wrong number of arguments for 'get' command\r\n");
            assertThat(run("PING", "extra")).isEqualTo("-ERR wrong number of arguments for 'ping' command\r\n");
        }

        @Test
        void commandNameIsCaseInsensitive() {
            assertThat(run("ping")).isEqualTo("+PONG\r\n");
            assertThat(run("eChO", "hey")).isEqualTo("$3\r\nhey\r\n");
        }

        @Test
        void nullBulkArgumentIsRejected() {
            final Resp reply = dispatcher.dispatch(new RespArray(new Resp[]{
                    BulkString.fromString("GET"), BulkString.NULL}), null);
            assertThat(reply.toString()).isEqualTo("ERR Protocol error: invalid null bulk argument");
        }

        @Test
        void connectionStaysUsableAfterError() {
            run("SET", "s", "v");
            assertThat(run("LLEN", "s")).startsWith("-WRONGTYPE");
            assertThat(run("GET", "s")).isEqualTo("$1\r\nv\r\n");
        }
    }

    @Nested
    @DisplayName("键与字符串")
    class KeysAndStrings {

        @Test
        void setGetAndOverwrite() {
            assertThat(run("GET", "k")).isEqualTo("$-1\r\n");
            assertThat(run("SET", "k", "v1")).isEqualTo("+OK\r\n");
            assertThat(run("SET", "k", "v2")).isEqualTo("+OK\r\n");
            assertThat(run("GET", "k")).isEqualTo("$2\r\nv2\r\n");
        }

        @Test
        void setOverwritesOtherTypes() {
            run("RPUSH", "k", "a");
            run("SET", "k", "v");
            assertThat(run("TYPE", "k")).isEqualTo("+string\r\n");
        }

        @Test
        void getOnListIsWrongType() {
            run("RPUSH", "l", "a");
            assertThat(run("GET", "l"))
                    .isEqualTo("-WRONGTYPE Operation against a key holding the wrong kind of value\r\n");
        }

        @Test
        void typeReportsEveryKind() {
            run("SET", "s", "v");
            run("RPUSH", "l", "a");
            run("SADD", "t", "a");
            run("XADD", "x", "*", "f", "v");
            assertThat(run("TYPE", "s")).isEqualTo("+string\r\n");
            assertThat(run("TYPE", "l")).isEqualTo("+list\r\n");
            assertThat(run("TYPE", "t")).isEqualTo("+set\r\n");
            assertThat(run("TYPE", "x")).isEqualTo("+stream\r\n");
            assertThat(run("TYPE", "missing")).isEqualTo("+none\r\n");
        }

        @Test
        void existsCountsDuplicates() {
            run("SET", "a", "1");
            assertThat(run("EXISTS", "a", "a", "b")).isEqualTo(":2\r\n");
        }

        @Test
        void delCountsRemovedKeys() {
            run("SET", "a", "1");
            run("SET", "b", "2");
            assertThat(run("DEL", "a", "b", "c")).isEqualTo(":2\r\n");
            assertThat(run("EXISTS", "a", "b")).isEqualTo(":0\r\n");
        }

        @Test
        void incr() {
            assertThat(run("INCR", "n")).isEqualTo(":1\r\n");
            assertThat(run("INCR", "n")).isEqualTo(":2\r\n");
            run("SET", "m", "-5");
            assertThat(run("INCR", "m")).isEqualTo(":-4\r\n");
            assertThat(run("GET", "m")).isEqualTo("$2\r\n-4\r\n");
        }

        @Test
        void incrRejectsNonIntegerAndOverflow() {
            run("SET", "s", "abc");
            assertThat(run("INCR", "s")).isEqualTo("-ERR value is not an integer or out of range\r\n");
            run("SET", "max", "9223372036854775807");
            assertThat(run("INCR", "max")).isEqualTo("-ERR value is not an integer or out of range\r\n");
            assertThat(run("GET", "max")).isEqualTo("$19\r\n9223372036854775807\r\n");
        }

        @Test
        void flushdbClearsEverything() {
            run("SET", "a", "1");
            run("RPUSH", "l", "x");
            assertThat(run("FLUSHDB")).isEqualTo("+OK\r\n");
            assertThat(redisCore.size()).isZero();
            assertThat(run("FLUSHDB", "ASYNC")).isEqualTo("+OK\r\n");
            assertThat(run("FLUSHDB", "later")).isEqualTo("-ERR syntax error\r\n");
        }
    }

    @Nested
    @DisplayName("列表")
    class Lists {

        @Test
        void rpushAndLpushOrder() {
            assertThat(run("RPUSH", "l", "a", "b")).isEqualTo(":2\r\n");
            assertThat(run("LPUSH", "l", "x", "y")).isEqualTo(":4\r\n");
            assertThat(run("LRANGE", "l", "0", "-1"))
                    .isEqualTo("*4\r\n$1\r\ny\r\n$1\r\nx\r\n$1\r\na\r\n$1\r\nb\r\n");
        }

        @Test
        void lrangeClampsAndHandlesEmptyRanges() {
            run("RPUSH", "l", "a", "b", "c");
            assertThat(run("LRANGE", "l", "-2", "100")).isEqualTo("*2\r\n$1\r\nb\r\n$1\r\nc\r\n");
            assertThat(run("LRANGE", "l", "2", "1")).isEqualTo("*0\r\n");
            assertThat(run("LRANGE", "missing", "0", "-1")).isEqualTo("*0\r\n");
            assertThat(run("LRANGE", "l", "a", "1")).isEqualTo("-ERR value is not an integer or out of range\r\n");
        }

        @Test
        void llen() {
            assertThat(run("LLEN", "l")).isEqualTo(":0\r\n");
            run("RPUSH", "l", "a", "b");
            assertThat(run("LLEN", "l")).isEqualTo(":2\r\n");
        }

        @Test
        void lpopSingleRemovesEmptyList() {
            assertThat(run("LPOP", "l")).isEqualTo("$-1\r\n");
            run("RPUSH", "l", "a");
            assertThat(run("LPOP", "l")).isEqualTo("$1\r\na\r\n");
            assertThat(run("EXISTS", "l")).isEqualTo(":0\r\n");
            assertThat(run("TYPE", "l")).isEqualTo("+none\r\n");
        }

        @Test
        void lpopWithCount() {
            run("RPUSH", "l", "a");
            assertThat(run("LPOP", "l", "2")).isEqualTo("*1\r\n$1\r\na\r\n");
            assertThat(run("EXISTS", "l")).isEqualTo(":0\r\n");
            assertThat(run("LPOP", "l", "2")).isEqualTo("*0\r\n");

            run("RPUSH", "l", "a", "b", "c");
            assertThat(run("LPOP", "l", "0")).isEqualTo("*0\r\n");
            assertThat(run("LPOP", "l", "2")).isEqualTo("*2\r\n$1\r\na\r\n$1\r\nb\r\n");
            assertThat(run("LPOP", "l", "-1")).isEqualTo("-ERR value is out of range, must be positive\r\n");
        }

        @Test
        void blpopReturnsImmediatelyWhenDataExists() {
            run("RPUSH", "l", "a", "b");
            assertThat(run("BLPOP", "l", "0")).isEqualTo("*2\r\n$1\r\nl\r\n$1\r\na\r\n");
            assertThat(run("LLEN", "l")).isEqualTo(":1\r\n");
        }

        @Test
        void blpopWithoutConnectionDoesNotBlock() {
            assertThat(run("BLPOP", "l", "0")).isEqualTo("*-1\r\n");
        }

        @Test
        void blpopValidatesArguments() {
            assertThat(run("BLPOP", "l", "-1")).isEqualTo("-ERR timeout is negative\r\n");
            assertThat(run("BLPOP", "l", "soon")).isEqualTo("-ERR timeout is not a float or out of range\r\n");
            run("SET", "s", "v");
            assertThat(run("BLPOP", "s", "0")).startsWith("-WRONGTYPE");
        }

        @Test
        void pushOnStringIsWrongType() {
            run("SET", "s", "v");
            assertThat(run("RPUSH", "s", "a")).startsWith("-WRONGTYPE");
            assertThat(run("GET", "s")).isEqualTo("$1\r\nv\r\n");
        }
    }

    @Nested
    @DisplayName("集合")
    class Sets {

        @Test
        void addRemoveAndMembers() {
            assertThat(run("SADD", "s", "a", "b", "a")).isEqualTo(":2\r\n");
            assertThat(run("SADD", "s", "b", "c")).isEqualTo(":1\r\n");
            assertThat(run("SCARD", "s")).isEqualTo(":3\r\n");
            assertThat(run("SMEMBERS", "s")).isEqualTo("*3\r\n$1\r\na\r\n$1\r\nb\r\n$1\r\nc\r\n");
            assertThat(run("SISMEMBER", "s", "b")).isEqualTo(":1\r\n");
            assertThat(run("SISMEMBER", "s", "z")).isEqualTo(":0\r\n");
            assertThat(run("SREM", "s", "a", "z")).isEqualTo(":1\r\n");
            assertThat(run("SREM", "s", "b", "c")).isEqualTo(":2\r\n");
            assertThat(run("EXISTS", "s")).isEqualTo(":0\r\n");
            assertThat(run("SMEMBERS", "s")).isEqualTo("*0\r\n");
        }

        @Test
        void algebra() {
            run("SADD", "a", "1", "2", "3");
            run("SADD", "b", "2", "3", "4");
            assertThat(run("SINTER", "a", "b")).isEqualTo("*2\r\n$1\r\n2\r\n$1\r\n3\r\n");
            assertThat(run("SUNION", "a", "b")).isEqualTo("*4\r\n$1\r\n1\r\n$1\r\n2\r\n$1\r\n3\r\n$1\r\n4\r\n");
            assertThat(run("SDIFF", "a", "b")).isEqualTo("*1\r\n$1\r\n1\r\n");
            assertThat(run("SINTER", "a", "missing")).isEqualTo("*0\r\n");
        }

        @Test
        void storeFormsOverwriteOrDeleteDestination() {
            run("SADD", "a", "1", "2");
            run("SADD", "b", "2");
            run("SET", "dest", "old");
            assertThat(run("SUNIONSTORE", "dest", "a", "b")).isEqualTo(":2\r\n");
            assertThat(run("TYPE", "dest")).isEqualTo("+set\r\n");
            assertThat(run("SDIFFSTORE", "dest", "b", "a")).isEqualTo(":0\r\n");
            assertThat(run("EXISTS", "dest")).isEqualTo(":0\r\n");
            assertThat(run("SINTERSTORE", "a", "a", "b")).isEqualTo(":1\r\n");
            assertThat(run("SMEMBERS", "a")).isEqualTo("*1\r\n$1\r\n2\r\n");
        }

        @Test
        void algebraOnWrongTypeFailsWithoutWriting() {
            run("SADD", "a", "1");
            run("SET", "s", "v");
            assertThat(run("SUNIONSTORE", "dest", "a", "s")).startsWith("-WRONGTYPE");
            assertThat(run("EXISTS", "dest")).isEqualTo(":0\r\n");
        }
    }

    @Nested
    @DisplayName("流")
    class Streams {

        @Test
        void explicitIdsMustIncrease() {
            assertThat(run("XADD", "x", "1-1", "f", "v")).isEqualTo("$3\r\n1-1\r\n");
            assertThat(run("XADD", "x", "1-1", "f", "v"))
                    .isEqualTo("-ERR The ID specified in XADD is equal or smaller than the target stream top item\r\n");
            assertThat(run("XADD", "x", "0-1", "f", "v"))
                    .isEqualTo("-ERR The ID specified in XADD is equal or smaller than the target stream top item\r\n");
            assertThat(run("XADD", "x", "1-2", "f", "v")).isEqualTo("$3\r\n1-2\r\n");
        }

        @Test
        void zeroIdIsRejectedEvenOnEmptyStream() {
            assertThat(run("XADD", "x", "0-0", "f", "v"))
                    .isEqualTo("-ERR The ID specified in XADD must be greater than 0-0\r\n");
            assertThat(run("EXISTS", "x")).isEqualTo(":0\r\n");
        }

        @Test
        void autoIds() {
            assertThat(run("XADD", "x", "*", "f", "v")).isEqualTo("$6\r\n1000-0\r\n");
            assertThat(run("XADD", "x", "*", "f", "v")).isEqualTo("$6\r\n1000-1\r\n");
            clock.set(2000);
            assertThat(run("XADD", "x", "*", "f", "v")).isEqualTo("$6\r\n2000-0\r\n");
            // 时钟回拨
            clock.set(500);
            assertThat(run("XADD", "x", "*", "f", "v")).isEqualTo("$6\r\n2000-1\r\n");
        }

        @Test
        void autoIdAfterLastPossibleIdFails() {
            final String max = Long.MAX_VALUE + "-" + Long.MAX_VALUE;
            assertThat(run("XADD", "x", max, "f", "v")).isEqualTo("$" + max.length() + "\r\n" + max + "\r\n");

            assertThat(run("XADD", "x", "*", "f", "v"))
                    .isEqualTo("-ERR The stream has exhausted the last possible ID, unable to add more items\r\n");
            assertThat(run("XRANGE", "x", "-", "+")).startsWith("*1\r\n");
        }

        @Test
        void partialAutoIds() {
            assertThat(run("XADD", "x", "0-*", "f", "v")).isEqualTo("$3\r\n0-1\r\n");
            assertThat(run("XADD", "x", "5-*", "f", "v")).isEqualTo("$3\r\n5-0\r\n");
            assertThat(run("XADD", "x", "5-*", "f", "v")).isEqualTo("$3\r\n5-1\r\n");
            assertThat(run("XADD", "x", "4-*", "f", "v")).startsWith("-ERR The ID specified in XADD is equal");
        }

        @Test
        void invalidIdAndOddFields() {
            assertThat(run("XADD", "x", "abc", "f", "v"))
                    .isEqualTo("-ERR Invalid stream ID specified as stream command argument\r\n");
            assertThat(run("XADD", "x", "*", "f", "v", "g"))
                    .isEqualTo("-ERR wrong number of arguments for 'xadd' command\r\n");
        }

        @Test
        void xrange() {
            run("XADD", "x", "1-1", "a", "1");
            run("XADD", "x", "2-1", "b", "2", "c", "3");
            run("XADD", "x", "3-1", "d", "4");

            assertThat(run("XRANGE", "x", "2", "2")).isEqualTo(
                    "*1\r\n*2\r\n$3\r\n2-1\r\n*4\r\n$1\r\nb\r\n$1\r\n2\r\n$1\r\nc\r\n$1\r\n3\r\n");
            assertThat(run("XRANGE", "x", "-", "+", "COUNT", "2")).startsWith("*2\r\n*2\r\n$3\r\n1-1\r\n");
            assertThat(run("XRANGE", "x", "-", "+", "count", "0")).isEqualTo("*0\r\n");
            assertThat(run("XRANGE", "x", "4", "+")).isEqualTo("*0\r\n");
            assertThat(run("XRANGE", "missing", "-", "+")).isEqualTo("*0\r\n");
            assertThat(run("XRANGE", "x", "-", "+", "COUNT")).isEqualTo("-ERR syntax error\r\n");
            assertThat(run("XRANGE", "x", "-", "+", "LIMIT", "1")).isEqualTo("-ERR syntax error\r\n");
        }

        @Test
        void xaddOnListIsWrongType() {
            run("RPUSH", "l", "a");
            assertThat(run("XADD", "l", "*", "f", "v")).startsWith("-WRONGTYPE");
        }
    }

    @Nested
    @DisplayName("服务器")
    class Server {

        @Test
        void shutdownRunsActionWithoutReply() {
            assertThat(run("SHUTDOWN")).isNull();
            verify(shutdownAction).run();
        }

        @Test
        void shutdownRejectsUnknownModifier() {
            assertThat(run("SHUTDOWN", "NOW")).isEqualTo("-ERR syntax error\r\n");
            verify(shutdownAction, never()).run();
        }

        @Test
        void quitWithoutConnectionStillReplies() {
            assertThat(run("QUIT")).isEqualTo("+OK\r\n");
        }
    }
}
