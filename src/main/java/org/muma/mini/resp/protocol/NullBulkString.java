package org.muma.mini.resp.protocol;

// $-1，与空字符串 $0 区分开
public record NullBulkString() implements RedisMessage {

    public static final NullBulkString INSTANCE = new NullBulkString();

    @Override
    public RespType type() {
        return RespType.BULK_STRING;
    }

    @Override
    public boolean isNull() {
        return true;
    }
}
