package org.muma.mini.resp.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 4. 批量字符串 ($)
 * 内容是原始字节，不做任何字符集解释；$-1 由 {@link NullBulkString} 表示。
 * record 默认对数组按引用比较，这里改为按内容比较。
 * 构造和 {@link #content()} 都会拷贝数组，外部修改不影响 equals / hashCode。
 */
public record BulkString(byte[] content) implements RedisMessage {

    public BulkString {
        if (content == null) {
            throw new IllegalArgumentException("content must not be null, use NullBulkString for $-1");
        }
        content = content.clone();
    }

    public BulkString(String s) {
        this(s.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public RespType type() {
        return RespType.BULK_STRING;
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    public int length() {
        return content.length;
    }

    public String asString() {
        return new String(content, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BulkString other)) return false;
        return Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "BulkString[" + asString() + "]";
    }
}
