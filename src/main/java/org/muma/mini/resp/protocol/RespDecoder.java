package org.muma.mini.resp.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.TooLongFrameException;
import org.muma.mini.resp.utils.RespCodecUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * RESP 帧解码器 (Netty 入站 Handler)
 * <p>
 * 每次从可读字节中切出一个完整的帧交给 {@link RespParser}：
 * 完整则跳过 consumed 个字节并向后传递；数据不足则原样保留，等待下一次 channelRead；
 * 非法数据直接抛出 {@link CorruptedFrameException}，由下游的 exceptionCaught 决定是否断开连接。
 * <p>
 * 有状态 (累积缓冲区)，每个 Channel 一个实例。
 */
public class RespDecoder extends ByteToMessageDecoder {

    private static final Logger log = LoggerFactory.getLogger(RespDecoder.class);

    // 日志里最多打印的字节数
    private static final int PREVIEW_LENGTH = 64;

    private final RespParser parser;

    // 上一次数据不足时，当前帧至少需要的字节数。大 BulkString 分多个包到达时，凑够之前不重复解析
    private long pendingFrameLength;

    public RespDecoder() {
        this(new RespParser());
    }

    public RespDecoder(RespParser parser) {
        this.parser = parser;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        int readable = in.readableBytes();
        if (readable < pendingFrameLength) {
            return;
        }
        DecodeResult result;
        if (in.hasArray()) {
            result = parser.tryParse(in.array(), in.arrayOffset() + in.readerIndex(), readable);
        } else {
            // 堆外内存：拷贝一份再解析，readerIndex 不动
            byte[] bytes = new byte[readable];
            in.getBytes(in.readerIndex(), bytes);
            result = parser.tryParse(bytes, 0, readable);
        }

        if (result instanceof DecodeResult.Incomplete incomplete) {
            pendingFrameLength = incomplete.failure().getRequired();
            return;
        }
        pendingFrameLength = 0;
        if (result instanceof DecodeResult.Complete complete) {
            in.skipBytes(complete.consumed());
            out.add(complete.message());
        } else if (result instanceof DecodeResult.Invalid invalid) {
            RespDecodeException cause = invalid.failure();
            log.warn("Invalid RESP frame from {}: {} [{}]",
                    ctx.channel().remoteAddress(), cause.getMessage(), RespCodecUtil.preview(in, PREVIEW_LENGTH));
            // 丢弃剩余数据，这个连接上的字节流已经无法再对齐
            in.skipBytes(in.readableBytes());
            if (cause.getError().isLimitViolation()) {
                throw new TooLongFrameException(cause.getMessage(), cause);
            }
            throw new CorruptedFrameException(cause.getMessage(), cause);
        }
    }
}
