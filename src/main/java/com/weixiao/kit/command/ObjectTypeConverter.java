package com.weixiao.kit.command;

import com.weixiao.kit.obj.ObjectType;
import picocli.CommandLine.ITypeConverter;

/**
 * 命令行中的类型名（blob / tree / commit / tag）转为 {@link ObjectType}。
 */
class ObjectTypeConverter implements ITypeConverter<ObjectType> {

    @Override
    public ObjectType convert(String value) throws Exception {
        return ObjectType.fromName(value);
    }
}
