package com.weixiao.kit.errors;

import java.nio.file.FileSystemException;

/**
 * 期望是普通文件的路径实际上是目录。
 */
public class NotAFileException extends FileSystemException {
    private static final long serialVersionUID = 1L;

    public NotAFileException(String file) {
        super(file, null, "is a directory, not a file");
    }
}
