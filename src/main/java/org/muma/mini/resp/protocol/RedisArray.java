package org.muma.mini.resp.protocol;

import java.util.List;

/**
 * 5. 数组 (*)，元素可以是任意类型，包括嵌套数组
 * *-1 由 {@link NullArray} 表示
 */
public record RedisArray(List<RedisMessage> elements) implements RedisMessage {

    public RedisArray {
        elements = List.copyOf(elements);
    }

    public RedisArray(RedisMessage... elements) {
        this(List.of(elements));
    }

    @Override
    public RespType type() {
        return RespType.ARRAY;
    }

    public int size() {
        return elements.size();
    }

    public RedisMessage get(int index) {
        return elements.get(index);
    }
}
