package org.muma.mini.resp.protocol;

/**
 * 2. 错误 (-)
 * kind 为全大写的错误前缀 (ERR, WRONGTYPE ...)，message 与简单字符串规则相同
 */
public record ErrorMessage(String kind, String message) implements RedisMessage {

    @Override
    public RespType type() {
        return RespType.ERROR;
    }

    // 还原成 "ERR unknown command" 这种常见的展示形式
    public String content() {
        return kind + " " + message;
    }
}
