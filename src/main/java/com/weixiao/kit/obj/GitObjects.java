package com.weixiao.kit.obj;

import com.weixiao.kit.errors.CorruptObjectException;
import com.weixiao.kit.errors.UnsupportedObjectTypeException;
import lombok.experimental.UtilityClass;

/**
 * 按类型标签把对象体字节分派给对应的解析器。
 */
@UtilityClass
public class GitObjects {

    /**
     * 解析对象体。
     *
     * @param type    对象头中的类型
     * @param payload NUL 之后的全部字节
     * @throws CorruptObjectException          对象体不符合该类型的格式
     * @throws UnsupportedObjectTypeException tag 类型
     */
    public static GitObject parse(ObjectType type, byte[] payload)
            throws CorruptObjectException, UnsupportedObjectTypeException {
        switch (type) {
            case BLOB:
                return Blob.parse(payload);
            case TREE:
                return Tree.parse(payload);
            case COMMIT:
                return Commit.parse(payload);
            case TAG:
            default:
                throw new UnsupportedObjectTypeException(type);
        }
    }
}
