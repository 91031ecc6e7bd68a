package org.muma.mini.resp.protocol;

// *-1，与空数组 *0 区分开
public record NullArray() implements RedisMessage {

    public static final NullArray INSTANCE = new NullArray();

    @Override
    public RespType type() {
        return RespType.ARRAY;
    }

    @Override
    public boolean isNull() {
        return true;
    }
}
