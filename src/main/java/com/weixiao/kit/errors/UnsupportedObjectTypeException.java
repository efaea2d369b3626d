package com.weixiao.kit.errors;

import com.weixiao.kit.obj.ObjectType;

import java.io.IOException;

/**
 * 可识别但未实现内容编解码的对象类型（目前只有 tag）。
 */
public class UnsupportedObjectTypeException extends IOException {
    private static final long serialVersionUID = 1L;

    public UnsupportedObjectTypeException(ObjectType type) {
        super(type.getTypeName() + " objects are not supported");
    }
}
