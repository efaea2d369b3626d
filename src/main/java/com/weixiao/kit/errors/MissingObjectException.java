package com.weixiao.kit.errors;

import java.io.IOException;

/**
 * 对象库中不存在给定 oid 的对象文件。
 */
public class MissingObjectException extends IOException {
    private static final long serialVersionUID = 1L;

    private final String oid;

    public MissingObjectException(String oid) {
        super("object not found: " + oid);
        this.oid = oid;
    }

    public String getObjectId() {
        return oid;
    }
}
