package com.weixiao.kit.walk;

import com.weixiao.kit.obj.Commit;
import com.weixiao.kit.repo.ObjectDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * 提交祖先遍历（log）：从一个提交出发深度优先访问全部祖先，输出子 → 父的边。
 * <p>
 * 每条 parent 记录都会产生一条边，但每个提交只展开一次，
 * 所以菱形合并中的公共祖先及其祖先只会被访问一次。
 * 使用显式栈，边的顺序与递归实现一致：先输出边，再深入该父提交。
 */
public final class AncestryWalker {

    private static final Logger log = LoggerFactory.getLogger(AncestryWalker.class);

    private final ObjectDatabase database;

    public AncestryWalker(ObjectDatabase database) {
        this.database = database;
    }

    /**
     * 从 start 开始遍历，visited 初始为空。
     */
    public List<Edge> walk(String start) throws IOException {
        return walk(start, new HashSet<>());
    }

    /**
     * 从 start 开始遍历；visited 中已有的提交不再展开，遍历过的提交会加入 visited。
     *
     * @throws com.weixiao.kit.errors.UnexpectedObjectTypeException 某个 oid 指向的不是 commit
     */
    public List<Edge> walk(String start, Set<String> visited) throws IOException {
        List<Edge> edges = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();
        enter(start, visited, stack);
        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (!top.parents.hasNext()) {
                stack.pop();
                continue;
            }
            String parent = top.parents.next();
            edges.add(new Edge(top.oid, parent));
            enter(parent, visited, stack);
        }
        log.debug("walked from {} edges={} visited={}", start, edges.size(), visited.size());
        return edges;
    }

    private void enter(String oid, Set<String> visited, Deque<Frame> stack) throws IOException {
        if (!visited.add(oid)) {
            return;
        }
        Commit commit = database.readCommit(oid);
        stack.push(new Frame(oid, commit.getParents().iterator()));
    }

    private static final class Frame {
        final String oid;
        final Iterator<String> parents;

        Frame(String oid, Iterator<String> parents) {
            this.oid = oid;
            this.parents = parents;
        }
    }
}
