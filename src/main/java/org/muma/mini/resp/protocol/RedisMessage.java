package org.muma.mini.resp.protocol;

// 密封接口，限制实现类：RESP2 的全部取值类型
public sealed interface RedisMessage permits
        SimpleString, ErrorMessage, RedisInteger, BulkString, NullBulkString, RedisArray, NullArray {

    /**
     * 对应的 RESP 类型标识
     */
    RespType type();

    /**
     * Null Bulk String ($-1) 和 Null Array (*-1) 返回 true
     */
    default boolean isNull() {
        return false;
    }
}
