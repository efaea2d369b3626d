package com.weixiao.kit.obj;

import com.weixiao.kit.errors.UnknownObjectTypeException;

/**
 * 对象类型的封闭集合。对象头中的类型名即 {@link #getTypeName()}。
 * tag 可以被识别，但没有内容编解码实现。
 */
public enum ObjectType {
    BLOB("blob"),
    TREE("tree"),
    COMMIT("commit"),
    TAG("tag");

    private final String typeName;

    ObjectType(String typeName) {
        this.typeName = typeName;
    }

    /** 小写类型名，如 "blob"。 */
    public String getTypeName() {
        return typeName;
    }

    /**
     * 按对象头中的类型名查找类型。
     *
     * @throws UnknownObjectTypeException 类型名不在集合内
     */
    public static ObjectType fromName(String name) throws UnknownObjectTypeException {
        for (ObjectType type : values()) {
            if (type.typeName.equals(name)) {
                return type;
            }
        }
        throw new UnknownObjectTypeException(name);
    }

    @Override
    public String toString() {
        return typeName;
    }
}
