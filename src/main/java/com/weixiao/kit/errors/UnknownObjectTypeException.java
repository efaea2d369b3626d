package com.weixiao.kit.errors;

/**
 * 对象头中的类型名不在 blob / tree / commit / tag 之内。
 */
public class UnknownObjectTypeException extends CorruptObjectException {
    private static final long serialVersionUID = 1L;

    private final String typeName;

    public UnknownObjectTypeException(String typeName) {
        super("unknown object type: " + typeName);
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
