package org.muma.mini.resp.protocol;

/**
 * RESP 解码失败。
 * <p>
 * incomplete 为 true 表示失败是因为输入提前结束：数据本身是某个合法帧的前缀，
 * 补齐后可能成功。网络层据此决定是继续等待数据还是断开连接。
 */
public class RespDecodeException extends RuntimeException {

    private final DecodeError error;
    private final int position;
    private final boolean incomplete;
    private final long required;

    public RespDecodeException(DecodeError error, int position, boolean incomplete) {
        this(error, position, incomplete, error.description());
    }

    public RespDecodeException(DecodeError error, int position, boolean incomplete, String detail) {
        this(error, position, incomplete, detail, 0);
    }

    /**
     * 数据不足，并且已知整个帧至少需要 required 个字节
     */
    public RespDecodeException(DecodeError error, int position, String detail, long required) {
        this(error, position, true, detail, required);
    }

    private RespDecodeException(DecodeError error, int position, boolean incomplete, String detail, long required) {
        super(error + " at offset " + position + ": " + detail);
        this.error = error;
        this.position = position;
        this.incomplete = incomplete;
        this.required = required;
    }

    public DecodeError getError() {
        return error;
    }

    /**
     * 检测到问题时相对于输入起点的字节偏移
     */
    public int getPosition() {
        return position;
    }

    public boolean isIncomplete() {
        return incomplete;
    }

    /**
     * 数据不足时，帧总长度的下界 (相对于输入起点)；非法数据时为 0
     */
    public long getRequired() {
        return required;
    }
}
