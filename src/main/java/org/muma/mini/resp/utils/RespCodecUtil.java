package org.muma.mini.resp.utils;

import io.netty.buffer.ByteBuf;

/**
 * RESP 日志辅助工具
 * 把原始字节转成一行可读文本，CR/LF 和不可见字符转义，用于打印出错的帧
 */
public class RespCodecUtil {

    private RespCodecUtil() {
    }

    public static String preview(byte[] bytes, int offset, int length, int maxLength) {
        int end = offset + Math.min(length, maxLength);
        StringBuilder sb = new StringBuilder(Math.min(length, maxLength) + 8);
        for (int i = offset; i < end; i++) {
            appendEscaped(sb, bytes[i]);
        }
        if (length > maxLength) {
            sb.append("...");
        }
        return sb.toString();
    }

    /**
     * 不移动 readerIndex
     */
    public static String preview(ByteBuf buf, int maxLength) {
        int readable = buf.readableBytes();
        int end = buf.readerIndex() + Math.min(readable, maxLength);
        StringBuilder sb = new StringBuilder(Math.min(readable, maxLength) + 8);
        for (int i = buf.readerIndex(); i < end; i++) {
            appendEscaped(sb, buf.getByte(i));
        }
        if (readable > maxLength) {
            sb.append("...");
        }
        return sb.toString();
    }

    private static void appendEscaped(StringBuilder sb, byte b) {
        switch (b) {
            case '\r' -> sb.append("\\r");
            case '\n' -> sb.append("\\n");
            case '\\' -> sb.append("\\\\");
            default -> {
                if (b >= 0x20 && b < 0x7F) {
                    sb.append((char) b);
                } else {
                    sb.append(String.format("\\x%02x", b & 0xFF));
                }
            }
        }
    }
}
