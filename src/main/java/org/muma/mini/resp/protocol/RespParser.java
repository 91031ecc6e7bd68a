package org.muma.mini.resp.protocol;

import org.muma.mini.resp.config.RespDecoderConfig;
import org.muma.mini.resp.utils.RespCodecUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * RESP2 解析器 (纯内存，无 I/O)
 * <p>
 * 递归下降：首字节分发到各类型的语法，数组再递归调用分发。
 * 每次调用使用独立的 {@link Cursor}，解析器本身只持有不可变的配置，可以多线程共享。
 * <p>
 * 两种调用方式：
 * <ul>
 *     <li>{@link #parse(byte[])}：严格模式，输入必须至少包含一个完整的帧，失败抛 {@link RespDecodeException}</li>
 *     <li>{@link #tryParse(byte[], int, int)}：流式模式，返回完整 / 数据不足 / 非法 三种结果，并报告消耗的字节数</li>
 * </ul>
 */
public class RespParser {

    private static final Logger log = LoggerFactory.getLogger(RespParser.class);

    // RESP 协议常量
    private static final byte CR = '\r';
    private static final byte LF = '\n';
    private static final byte SPACE = ' ';
    private static final byte PLUS = '+';
    private static final byte MINUS = '-';

    private static final long NULL_LENGTH = -1;

    // 最短的元素帧 ":0\r\n"，用于估算数组容量，避免按声明长度盲目分配
    private static final int MIN_FRAME_LENGTH = 4;

    private static final int PREVIEW_LENGTH = 64;

    private final int maxNestingDepth;
    private final long maxBulkLength;
    private final int maxInlineLength;

    public RespParser() {
        this(new RespDecoderConfig());
    }

    public RespParser(RespDecoderConfig config) {
        this.maxNestingDepth = config.getMaxNestingDepth();
        this.maxBulkLength = config.getMaxBulkLength();
        this.maxInlineLength = config.getMaxInlineLength();
    }

    // --- Strict API ---

    public RedisMessage parse(byte[] input) {
        return parse(input, 0, input.length);
    }

    /**
     * 解析 input[offset, offset + length) 中的第一个值，之后多余的字节被忽略
     *
     * @throws RespDecodeException 输入不合法或不完整
     */
    public RedisMessage parse(byte[] input, int offset, int length) {
        Cursor cursor = new Cursor(input, offset, length);
        return readMessage(cursor, 0);
    }

    /**
     * 不移动 buffer 的 position
     */
    public RedisMessage parse(ByteBuffer buffer) {
        if (buffer.hasArray()) {
            return parse(buffer.array(), buffer.arrayOffset() + buffer.position(), buffer.remaining());
        }
        return parse(copyRemaining(buffer));
    }

    /**
     * 连续解析 input 中的所有帧 (例如一段完整的 pipeline 请求)
     *
     * @throws RespDecodeException 任一帧非法，或末尾残留不完整的帧
     */
    public List<RedisMessage> parseAll(byte[] input) {
        Cursor cursor = new Cursor(input, 0, input.length);
        List<RedisMessage> messages = new ArrayList<>();
        while (cursor.hasRemaining()) {
            messages.add(readMessage(cursor, 0));
        }
        log.debug("Parsed {} frames from {} bytes", messages.size(), input.length);
        return messages;
    }

    // --- Streaming API ---

    public DecodeResult tryParse(byte[] input) {
        return tryParse(input, 0, input.length);
    }

    public DecodeResult tryParse(byte[] input, int offset, int length) {
        Cursor cursor = new Cursor(input, offset, length);
        try {
            RedisMessage message = readMessage(cursor, 0);
            return new DecodeResult.Complete(message, cursor.consumed());
        } catch (RespDecodeException e) {
            if (!e.isIncomplete()) {
                log.debug("Rejected RESP frame: {} [{}]", e.getMessage(),
                        RespCodecUtil.preview(input, offset, length, PREVIEW_LENGTH));
            }
            return DecodeResult.failed(e);
        }
    }

    /**
     * 解析成功时 buffer 的 position 前移 consumed 个字节，其他情况保持不变
     */
    public DecodeResult tryParse(ByteBuffer buffer) {
        DecodeResult result = buffer.hasArray()
                ? tryParse(buffer.array(), buffer.arrayOffset() + buffer.position(), buffer.remaining())
                : tryParse(copyRemaining(buffer));
        if (result instanceof DecodeResult.Complete complete) {
            buffer.position(buffer.position() + complete.consumed());
        }
        return result;
    }

    // --- Grammar ---

    // 分发：读取类型字节，交给对应的子语法。数组会递归回到这里
    private RedisMessage readMessage(Cursor c, int depth) {
        if (!c.hasRemaining()) {
            throw c.incomplete(DecodeError.UNRECOGNIZED_TYPE, "no input");
        }
        byte prefix = c.next();
        RespType type = RespType.fromPrefix(prefix);
        if (type == null) {
            throw c.invalid(DecodeError.UNRECOGNIZED_TYPE, c.pos - 1,
                    "unknown type byte 0x" + Integer.toHexString(prefix & 0xFF));
        }
        return switch (type) {
            case SIMPLE_STRING -> new SimpleString(readText(c));
            case ERROR -> readError(c);
            case INTEGER -> new RedisInteger(readLong(c));
            case BULK_STRING -> readBulkString(c);
            case ARRAY -> readArray(c, depth);
        };
    }

    /**
     * 简单字符串语法：一个以上非 CR/LF 字节，以 CRLF 结尾。
     * 错误信息也走这里，所以直接返回文本而不是 SimpleString。
     */
    private String readText(Cursor c) {
        int start = c.pos;
        while (c.hasRemaining()) {
            byte b = c.peek();
            if (b == CR || b == LF) {
                if (c.pos == start) {
                    throw c.invalid(DecodeError.EMPTY_CONTENT, start, "empty line");
                }
                int end = c.pos;
                readCrlf(c);
                return new String(c.buf, start, end - start, StandardCharsets.UTF_8);
            }
            if (c.pos - start >= maxInlineLength) {
                throw c.invalid(DecodeError.INLINE_TOO_LONG, start, "line longer than " + maxInlineLength + " bytes");
            }
            c.pos++;
        }
        throw c.incomplete(DecodeError.MALFORMED_TERMINATOR, "line not terminated");
    }

    private ErrorMessage readError(Cursor c) {
        // 1. 错误类型：连续的大写字母
        int kindStart = c.pos;
        while (c.hasRemaining() && isUpperCase(c.peek())) {
            if (c.pos - kindStart >= maxInlineLength) {
                throw c.invalid(DecodeError.INLINE_TOO_LONG, kindStart, "error kind too long");
            }
            c.pos++;
        }
        if (!c.hasRemaining()) {
            throw c.incomplete(c.pos == kindStart ? DecodeError.EMPTY_KIND : DecodeError.MISSING_SEPARATOR,
                    "error line not terminated");
        }
        if (c.pos == kindStart) {
            throw c.invalid(DecodeError.EMPTY_KIND, kindStart, "error kind must start with A-Z");
        }
        // "ErR"、"ERRor" 这种大小写混合的前缀整体不合法
        if (isLetter(c.peek())) {
            throw c.invalid(DecodeError.EMPTY_KIND, kindStart, "error kind must be all uppercase");
        }
        String kind = new String(c.buf, kindStart, c.pos - kindStart, StandardCharsets.US_ASCII);

        // 2. 分隔符：一个以上的空格或 LF (不含 CR)
        int separatorStart = c.pos;
        while (c.hasRemaining() && (c.peek() == SPACE || c.peek() == LF)) {
            c.pos++;
        }
        if (c.pos == separatorStart) {
            throw c.invalid(DecodeError.MISSING_SEPARATOR, separatorStart, "expected space after " + kind);
        }

        // 3. 错误信息，规则与简单字符串完全相同
        return new ErrorMessage(kind, readText(c));
    }

    /**
     * 整数语法：可选的单个 +/-，一个以上 ASCII 数字，CRLF。
     * Bulk String 和数组的长度字段共用这个语法。
     */
    private long readLong(Cursor c) {
        int start = c.pos;
        if (c.hasRemaining() && (c.peek() == PLUS || c.peek() == MINUS)) {
            c.pos++;
        }
        int digitsStart = c.pos;
        while (c.hasRemaining() && isDigit(c.peek())) {
            if (c.pos - start >= maxInlineLength) {
                throw c.invalid(DecodeError.INLINE_TOO_LONG, start, "number longer than " + maxInlineLength + " bytes");
            }
            c.pos++;
        }
        if (!c.hasRemaining()) {
            if (c.pos == digitsStart) {
                throw c.incomplete(DecodeError.MALFORMED_DIGITS, "number not terminated");
            }
            // 已读到的数字越界后，再追加数字也不可能回到范围内
            String partial = new String(c.buf, start, c.pos - start, StandardCharsets.US_ASCII);
            if (!fitsInLong(partial)) {
                throw c.invalid(DecodeError.OVERFLOW, start, partial);
            }
            throw c.incomplete(DecodeError.MALFORMED_TERMINATOR, "number not terminated");
        }
        if (c.pos == digitsStart) {
            throw c.invalid(DecodeError.MALFORMED_DIGITS, c.pos, "expected digit");
        }
        byte next = c.peek();
        if (next == LF) {
            throw c.invalid(DecodeError.MALFORMED_TERMINATOR, c.pos, "bare LF after number");
        }
        if (next != CR) {
            throw c.invalid(DecodeError.MALFORMED_DIGITS, c.pos, "unexpected byte 0x" + Integer.toHexString(next & 0xFF));
        }

        // 到这里只剩 ASCII 符号和数字，parseLong 失败只可能是越界
        String digits = new String(c.buf, start, c.pos - start, StandardCharsets.US_ASCII);
        long value;
        try {
            value = Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw c.invalid(DecodeError.OVERFLOW, start, digits);
        }
        readCrlf(c);
        return value;
    }

    // 解析 BulkString: $<length>\r\n<data>\r\n
    private RedisMessage readBulkString(Cursor c) {
        int lengthPos = c.pos;
        long length = readLong(c);
        if (length == NULL_LENGTH) {
            return NullBulkString.INSTANCE;
        }
        if (length < 0) {
            throw c.invalid(DecodeError.INVALID_LENGTH, lengthPos, "bulk length " + length);
        }
        if (length > maxBulkLength) {
            throw c.invalid(DecodeError.LENGTH_LIMIT_EXCEEDED, lengthPos,
                    "bulk length " + length + " exceeds " + maxBulkLength);
        }
        if (c.remaining() < length) {
            // 帧至少要到 payload 之后的 CRLF 为止，告诉调用方在此之前不必重试
            throw c.incomplete(DecodeError.TRUNCATED_PAYLOAD,
                    "declared " + length + " bytes, " + c.remaining() + " available",
                    c.consumed() + length + 2);
        }
        int size = (int) length;
        byte[] content = Arrays.copyOfRange(c.buf, c.pos, c.pos + size);
        c.pos += size;
        readCrlf(c);
        return new BulkString(content);
    }

    // 解析 Array: *<count>\r\n<element1>...<elementN>
    private RedisMessage readArray(Cursor c, int depth) {
        int countPos = c.pos;
        long count = readLong(c);
        if (count == NULL_LENGTH) {
            return NullArray.INSTANCE;
        }
        if (count < 0) {
            throw c.invalid(DecodeError.INVALID_LENGTH, countPos, "array count " + count);
        }
        if (depth >= maxNestingDepth) {
            throw c.invalid(DecodeError.RECURSION_LIMIT_EXCEEDED, countPos - 1,
                    "nesting deeper than " + maxNestingDepth);
        }

        int capacity = (int) Math.min(count, c.remaining() / MIN_FRAME_LENGTH);
        List<RedisMessage> elements = new ArrayList<>(capacity);
        for (long i = 0; i < count; i++) {
            if (!c.hasRemaining()) {
                throw c.incomplete(DecodeError.TRUNCATED_ELEMENTS, "declared " + count + " elements, got " + i);
            }
            elements.add(readMessage(c, depth + 1));
        }
        return new RedisArray(elements);
    }

    // 读取并校验 CRLF
    private void readCrlf(Cursor c) {
        if (!c.hasRemaining()) {
            throw c.incomplete(DecodeError.MALFORMED_TERMINATOR, "missing CR");
        }
        if (c.peek() != CR) {
            throw c.invalid(DecodeError.MALFORMED_TERMINATOR, c.pos, "expected CR");
        }
        if (c.remaining() < 2) {
            throw c.incomplete(DecodeError.MALFORMED_TERMINATOR, "missing LF");
        }
        if (c.peek(1) != LF) {
            throw c.invalid(DecodeError.MALFORMED_TERMINATOR, c.pos + 1, "expected LF after CR");
        }
        c.pos += 2;
    }

    private static boolean fitsInLong(String digits) {
        try {
            Long.parseLong(digits);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static boolean isDigit(byte b) {
        return b >= '0' && b <= '9';
    }

    private static boolean isUpperCase(byte b) {
        return b >= 'A' && b <= 'Z';
    }

    private static boolean isLetter(byte b) {
        return isUpperCase(b) || (b >= 'a' && b <= 'z');
    }

    private static byte[] copyRemaining(ByteBuffer buffer) {
        byte[] bytes = new byte[buffer.remaining()];
        buffer.duplicate().get(bytes);
        return bytes;
    }

    /**
     * 单次解析的读指针，偏移量都相对于 start 报告
     */
    private static final class Cursor {
        final byte[] buf;
        final int start;
        final int limit;
        int pos;

        Cursor(byte[] buf, int offset, int length) {
            Objects.checkFromIndexSize(offset, length, buf.length);
            this.buf = buf;
            this.start = offset;
            this.limit = offset + length;
            this.pos = offset;
        }

        boolean hasRemaining() {
            return pos < limit;
        }

        int remaining() {
            return limit - pos;
        }

        byte peek() {
            return buf[pos];
        }

        byte peek(int ahead) {
            return buf[pos + ahead];
        }

        byte next() {
            return buf[pos++];
        }

        int consumed() {
            return pos - start;
        }

        RespDecodeException incomplete(DecodeError error, String detail) {
            return incomplete(error, detail, limit - start + 1);
        }

        RespDecodeException incomplete(DecodeError error, String detail, long required) {
            return new RespDecodeException(error, limit - start, detail, required);
        }

        RespDecodeException invalid(DecodeError error, int at, String detail) {
            return new RespDecodeException(error, at - start, false, detail);
        }
    }
}
