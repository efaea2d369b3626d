package com.weixiao.kit.repo;

import lombok.Value;

/**
 * 解析后的引用：最终指向的 oid 与引用文件相对 .git 的路径（如 "refs/heads/master"）。
 */
@Value
public class Ref {
    String oid;
    String path;
}
