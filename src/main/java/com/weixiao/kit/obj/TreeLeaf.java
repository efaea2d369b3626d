package com.weixiao.kit.obj;

import lombok.Value;

/**
 * Tree 中的一条记录：模式 + 路径 + 子对象的 oid。
 * mode 保留解析时的原样（5 或 6 位 ASCII 数字，目录通常是 "40000"）。
 */
@Value
public class TreeLeaf {

    public static final String MODE_REGULAR = "100644";
    public static final String MODE_EXECUTABLE = "100755";
    public static final String MODE_TREE = "40000";

    String mode;
    String path;
    String oid; // 40 字符 hex

    /** 构造一条普通文件条目：mode=100644。 */
    public static TreeLeaf regularFile(String path, String oid) {
        return new TreeLeaf(MODE_REGULAR, path, oid);
    }

    /** 构造一条子目录条目：mode=40000。 */
    public static TreeLeaf directory(String path, String oid) {
        return new TreeLeaf(MODE_TREE, path, oid);
    }

    /** mode 补零到 6 位，ls-tree 输出用。 */
    public String paddedMode() {
        return mode.length() >= 6 ? mode : "0".repeat(6 - mode.length()) + mode;
    }
}
