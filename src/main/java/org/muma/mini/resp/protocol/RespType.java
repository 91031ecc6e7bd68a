package org.muma.mini.resp.protocol;

/**
 * RESP2 类型标识字节
 */
public enum RespType {

    SIMPLE_STRING((byte) '+'),
    ERROR((byte) '-'),
    INTEGER((byte) ':'),
    BULK_STRING((byte) '$'),
    ARRAY((byte) '*');

    private final byte prefix;

    RespType(byte prefix) {
        this.prefix = prefix;
    }

    public byte prefix() {
        return prefix;
    }

    /**
     * 根据首字节查找类型，无法识别时返回 null
     */
    public static RespType fromPrefix(byte b) {
        return switch (b) {
            case '+' -> SIMPLE_STRING;
            case '-' -> ERROR;
            case ':' -> INTEGER;
            case '$' -> BULK_STRING;
            case '*' -> ARRAY;
            default -> null;
        };
    }
}
