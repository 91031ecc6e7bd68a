package org.muma.mini.resp.protocol;

// 3. 整数 (:)，有符号 64 位
public record RedisInteger(long value) implements RedisMessage {

    @Override
    public RespType type() {
        return RespType.INTEGER;
    }
}
