package com.weixiao.kit.obj;

import java.util.Arrays;

/**
 * blob 对象：文件内容的原始字节。
 * 序列化格式即原始字节（无 header，由 ObjectDatabase 统一加 type + size）。
 */
public final class Blob implements GitObject {

    private final byte[] data;

    /** 用给定字节构造 blob，null 视为空数组并做拷贝避免外部修改。 */
    public Blob(byte[] data) {
        this.data = data != null ? data.clone() : new byte[0];
    }

    /** 对象体即 blob 内容，任何字节序列都合法。 */
    public static Blob parse(byte[] payload) {
        return new Blob(payload);
    }

    @Override
    public ObjectType getType() {
        return ObjectType.BLOB;
    }

    @Override
    public byte[] toBytes() {
        return Arrays.copyOf(data, data.length);
    }

    public int size() {
        return data.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Blob)) return false;
        return Arrays.equals(data, ((Blob) o).data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }
}
