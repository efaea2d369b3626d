package com.weixiao.kit.errors;

import java.io.IOException;

/**
 * 仓库配置缺失、无法解析，或 repositoryformatversion 不受支持。
 */
public class UnsupportedConfigurationException extends IOException {
    private static final long serialVersionUID = 1L;

    public UnsupportedConfigurationException(String why) {
        super(why);
    }

    public UnsupportedConfigurationException(String why, Throwable cause) {
        super(why, cause);
    }
}
