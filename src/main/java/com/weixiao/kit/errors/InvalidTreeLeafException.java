package com.weixiao.kit.errors;

/**
 * tree 二进制内容在某个偏移处不满足 "mode SP path NUL 20字节id" 语法。
 */
public class InvalidTreeLeafException extends CorruptObjectException {
    private static final long serialVersionUID = 1L;

    private final int offset;

    public InvalidTreeLeafException(int offset, String why) {
        super("invalid tree leaf at offset " + offset + ": " + why);
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }
}
