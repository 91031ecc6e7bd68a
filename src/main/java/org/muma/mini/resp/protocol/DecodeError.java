package org.muma.mini.resp.protocol;

/**
 * 解码失败的原因，每一项对应一条被违反的语法规则
 */
public enum DecodeError {

    // 首字节不是 + - : $ *，或输入为空
    UNRECOGNIZED_TYPE("unrecognized type prefix"),
    // 简单字符串 / 错误信息为空
    EMPTY_CONTENT("empty content"),
    // 错误类型前缀不是非空的全大写单词
    EMPTY_KIND("missing or non-uppercase error kind"),
    // 错误类型与错误信息之间缺少分隔符
    MISSING_SEPARATOR("missing separator after error kind"),
    MALFORMED_TERMINATOR("expected CRLF"),
    MALFORMED_DIGITS("malformed integer"),
    OVERFLOW("integer out of 64-bit range"),
    // 除 -1 以外的负长度
    INVALID_LENGTH("invalid negative length"),
    TRUNCATED_PAYLOAD("bulk payload shorter than declared length"),
    TRUNCATED_ELEMENTS("array has fewer elements than declared"),
    RECURSION_LIMIT_EXCEEDED("array nesting too deep"),
    LENGTH_LIMIT_EXCEEDED("bulk length exceeds limit"),
    INLINE_TOO_LONG("line exceeds limit");

    private final String description;

    DecodeError(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    /**
     * 超出配置上限的错误，传输层通常按 "帧过长" 处理
     */
    public boolean isLimitViolation() {
        return this == RECURSION_LIMIT_EXCEEDED || this == LENGTH_LIMIT_EXCEEDED || this == INLINE_TOO_LONG;
    }
}
