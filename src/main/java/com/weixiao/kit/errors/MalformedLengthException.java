package com.weixiao.kit.errors;

/**
 * 对象头声明的长度与 NUL 之后的实际字节数不一致，或长度字段不是十进制整数。
 */
public class MalformedLengthException extends CorruptObjectException {
    private static final long serialVersionUID = 1L;

    public MalformedLengthException(String oid, String why) {
        super("malformed object " + oid + ": " + why);
    }
}
