package org.muma.mini.resp.protocol;

// 1. 简单字符串 (+)，不含 CR / LF，且非空
public record SimpleString(String content) implements RedisMessage {

    @Override
    public RespType type() {
        return RespType.SIMPLE_STRING;
    }
}
