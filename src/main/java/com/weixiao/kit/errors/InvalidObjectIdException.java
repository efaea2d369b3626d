package com.weixiao.kit.errors;

/**
 * 内存中的 oid 不是 40 字符十六进制，无法编码为 tree 条目的 20 字节二进制 id。
 */
public class InvalidObjectIdException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public InvalidObjectIdException(String id) {
        super("invalid object id: " + id);
    }
}
