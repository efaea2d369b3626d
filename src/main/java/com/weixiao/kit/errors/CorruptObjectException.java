package com.weixiao.kit.errors;

import java.io.IOException;

/**
 * 对象文件无法读取为合法对象：压缩流损坏，或解压后的分帧/内容不符合格式。
 * 具体的格式错误见子类。
 */
public class CorruptObjectException extends IOException {
    private static final long serialVersionUID = 1L;

    public CorruptObjectException(String why) {
        super(why);
    }

    public CorruptObjectException(String why, Throwable cause) {
        super(why, cause);
    }
}
