package com.weixiao.kit.obj;

import com.weixiao.kit.errors.CorruptObjectException;

/**
 * 对象统一接口：blob、tree、commit。
 * 由 ObjectDatabase 加上 "type size\0" 分帧后计算 oid 并写入 .git/objects。
 * 对象之间只通过 oid 引用，不持有其他对象实例。
 */
public interface GitObject {

    /** 对象类型 */
    ObjectType getType();

    /**
     * 对象体字节（不含 type/size header）。
     *
     * @throws CorruptObjectException 内存中的对象无法编码成合法的对象体
     */
    byte[] toBytes() throws CorruptObjectException;
}
