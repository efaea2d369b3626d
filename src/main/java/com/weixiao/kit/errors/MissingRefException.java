package com.weixiao.kit.errors;

import java.io.IOException;

/**
 * 引用文件不存在，或名字无法解析为任何引用。
 */
public class MissingRefException extends IOException {
    private static final long serialVersionUID = 1L;

    private final String ref;

    public MissingRefException(String ref) {
        super("ref not found: " + ref);
        this.ref = ref;
    }

    public String getRef() {
        return ref;
    }
}
