package org.muma.mini.resp.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.TooLongFrameException;
import org.junit.jupiter.api.Test;
import org.muma.mini.resp.config.RespDecoderConfig;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RespDecoderTest {

    private static ByteBuf buf(String s) {
        return Unpooled.copiedBuffer(s, StandardCharsets.UTF_8);
    }

    @Test
    void testDecodePipelinedCommands() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        channel.writeInbound(buf("*2\r\n$3\r\nGET\r\n$3\r\nkey\r\n*1\r\n$4\r\nPING\r\n"));

        assertEquals(new RedisArray(new BulkString("GET"), new BulkString("key")), channel.readInbound());
        assertEquals(new RedisArray(new BulkString("PING")), channel.readInbound());
        assertNull(channel.readInbound());
        assertFalse(channel.finish());
    }

    /**
     * 测试场景：一个帧被拆成多个 TCP 包逐字节到达，直到最后一个字节才输出
     */
    @Test
    void testDecodeFrameSplitIntoSingleBytes() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());
        byte[] frame = "*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$5\r\nv\r\nxy\r\n".getBytes(StandardCharsets.UTF_8);

        for (int i = 0; i < frame.length - 1; i++) {
            channel.writeInbound(Unpooled.wrappedBuffer(new byte[]{frame[i]}));
            assertNull(channel.readInbound(), "no message before byte " + i);
        }
        channel.writeInbound(Unpooled.wrappedBuffer(new byte[]{frame[frame.length - 1]}));

        assertEquals(new RedisArray(new BulkString("SET"), new BulkString("k"), new BulkString("v\r\nxy")),
                channel.readInbound());
        assertFalse(channel.finish());
    }

    @Test
    void testFrameSpanningChunksWithFollowingFrame() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        channel.writeInbound(buf("+PO"));
        assertNull(channel.readInbound());
        channel.writeInbound(buf("NG\r\n:1"));
        assertEquals(new SimpleString("PONG"), channel.readInbound());
        assertNull(channel.readInbound());
        channel.writeInbound(buf("0\r\n"));
        assertEquals(new RedisInteger(10), channel.readInbound());
        assertFalse(channel.finish());
    }

    @Test
    void testDirectBuffer() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());
        ByteBuf direct = Unpooled.directBuffer();
        direct.writeBytes("-WRONGTYPE bad\r\n".getBytes(StandardCharsets.UTF_8));

        channel.writeInbound(direct);

        assertEquals(new ErrorMessage("WRONGTYPE", "bad"), channel.readInbound());
        assertFalse(channel.finish());
    }

    @Test
    void testCorruptedFrame() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        CorruptedFrameException e = assertThrows(CorruptedFrameException.class,
                () -> channel.writeInbound(buf(":12a\r\n")));
        RespDecodeException cause = assertInstanceOf(RespDecodeException.class, e.getCause());
        assertEquals(DecodeError.MALFORMED_DIGITS, cause.getError());
        channel.finishAndReleaseAll();
    }

    @Test
    void testTooLongFrame() {
        RespDecoderConfig config = new RespDecoderConfig();
        config.setMaxBulkLength(8);
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder(new RespParser(config)));

        TooLongFrameException e = assertThrows(TooLongFrameException.class,
                () -> channel.writeInbound(buf("$1024\r\n")));
        assertEquals(DecodeError.LENGTH_LIMIT_EXCEEDED, ((RespDecodeException) e.getCause()).getError());
        channel.finishAndReleaseAll();
    }

    @Test
    void testIncompleteLeavesBufferUntouched() {
        ChannelHandlerContext ctx = mock(ChannelHandlerContext.class);
        RespDecoder decoder = new RespDecoder();
        ByteBuf in = buf("$5\r\nhel");
        List<Object> out = new ArrayList<>();

        decoder.decode(ctx, in, out);

        assertTrue(out.isEmpty());
        assertEquals(0, in.readerIndex());
        // 数据不足时不应访问 Channel
        verifyNoInteractions(ctx);
        in.release();
    }

    /**
     * 测试场景：大 BulkString 分多个包到达，凑够声明长度之前不重复解析
     */
    @Test
    void testLargeBulkNotReparsedUntilEnoughBytes() {
        RespParser parser = spy(new RespParser());
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder(parser));

        channel.writeInbound(buf("$10\r\nab"));
        channel.writeInbound(buf("cd"));
        channel.writeInbound(buf("efgh"));
        assertNull(channel.readInbound());
        verify(parser, times(1)).tryParse(any(byte[].class), anyInt(), anyInt());

        channel.writeInbound(buf("ij\r\n+OK\r\n"));
        assertEquals(new BulkString("abcdefghij"), channel.readInbound());
        assertEquals(new SimpleString("OK"), channel.readInbound());
        assertFalse(channel.finish());
    }

    @Test
    void testInvalidDiscardsBufferAndLogsPeer() {
        ChannelHandlerContext ctx = mock(ChannelHandlerContext.class);
        Channel channel = mock(Channel.class);
        when(ctx.channel()).thenReturn(channel);
        when(channel.remoteAddress()).thenReturn(new InetSocketAddress("127.0.0.1", 6379));

        RespDecoder decoder = new RespDecoder();
        ByteBuf in = buf("?what\r\n+OK\r\n");
        List<Object> out = new ArrayList<>();

        assertThrows(CorruptedFrameException.class, () -> decoder.decode(ctx, in, out));

        assertTrue(out.isEmpty());
        assertFalse(in.isReadable());
        verify(channel).remoteAddress();
        in.release();
    }

    @Test
    void testCompleteSkipsConsumedBytesOnly() {
        ChannelHandlerContext ctx = mock(ChannelHandlerContext.class);
        RespDecoder decoder = new RespDecoder();
        ByteBuf in = buf(":1\r\n:2\r\n");
        List<Object> out = new ArrayList<>();

        decoder.decode(ctx, in, out);

        assertEquals(List.of(new RedisInteger(1)), out);
        assertEquals(4, in.readerIndex());
        in.release();
    }
}
