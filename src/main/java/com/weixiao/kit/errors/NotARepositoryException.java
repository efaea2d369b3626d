package com.weixiao.kit.errors;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 从起始目录一直向上到文件系统根都没有找到 .git 元数据目录。
 */
public class NotARepositoryException extends IOException {
    private static final long serialVersionUID = 1L;

    public NotARepositoryException(Path location) {
        super("not a kit repository (or any of the parent directories): " + location);
    }
}
