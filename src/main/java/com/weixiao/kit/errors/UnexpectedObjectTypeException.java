package com.weixiao.kit.errors;

import com.weixiao.kit.obj.ObjectType;

import java.io.IOException;

/**
 * 对象读取成功，但类型不是当前操作要求的类型（如 log 遇到非 commit）。
 */
public class UnexpectedObjectTypeException extends IOException {
    private static final long serialVersionUID = 1L;

    private final ObjectType expected;
    private final ObjectType actual;

    public UnexpectedObjectTypeException(String oid, ObjectType expected, ObjectType actual) {
        super("object " + oid + " is a " + actual.getTypeName() + ", not a " + expected.getTypeName());
        this.expected = expected;
        this.actual = actual;
    }

    public ObjectType getExpected() {
        return expected;
    }

    public ObjectType getActual() {
        return actual;
    }
}
