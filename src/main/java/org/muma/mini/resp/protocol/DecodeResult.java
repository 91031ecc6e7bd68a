package org.muma.mini.resp.protocol;

/**
 * 流式解码的三种结果：完整的值 / 数据不足 / 非法数据
 */
public sealed interface DecodeResult permits DecodeResult.Complete, DecodeResult.Incomplete, DecodeResult.Invalid {

    /**
     * 解出一个完整的值，consumed 为该帧占用的字节数，调用方据此跳到下一帧
     */
    record Complete(RedisMessage message, int consumed) implements DecodeResult {
    }

    /**
     * 输入是合法前缀但还没结束，需要更多数据。
     * failure 是严格模式下会抛出的异常，其 error 提示缺的是哪一部分。
     */
    record Incomplete(RespDecodeException failure) implements DecodeResult {
    }

    /**
     * 无论再追加什么数据都不可能合法
     */
    record Invalid(RespDecodeException failure) implements DecodeResult {
    }

    static DecodeResult failed(RespDecodeException e) {
        return e.isIncomplete() ? new Incomplete(e) : new Invalid(e);
    }
}
