package com.weixiao.kit.errors;

import java.io.IOException;

/**
 * 符号引用链成环或超过最大间接层数。
 */
public class SymbolicRefLoopException extends IOException {
    private static final long serialVersionUID = 1L;

    public SymbolicRefLoopException(String ref, int depth) {
        super("symbolic ref " + ref + " does not resolve within " + depth + " levels");
    }
}
