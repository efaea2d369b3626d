package com.weixiao.kit.walk;

import lombok.Value;

/**
 * 提交图中的一条有向边：子提交指向其父提交。
 */
@Value
public class Edge {
    String child;
    String parent;
}
