package com.weixiao.kit.walk;

import com.weixiao.kit.errors.CorruptObjectException;
import com.weixiao.kit.obj.Blob;
import com.weixiao.kit.obj.GitObject;
import com.weixiao.kit.obj.Tree;
import com.weixiao.kit.obj.TreeLeaf;
import com.weixiao.kit.repo.ObjectDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * 把 tree 对象展开到目录（checkout）：子 tree 建成子目录，blob 原样写成文件。
 * 目标目录是否为空由调用方检查。
 */
public final class TreeMaterializer {

    private static final Logger log = LoggerFactory.getLogger(TreeMaterializer.class);

    private final ObjectDatabase database;

    public TreeMaterializer(ObjectDatabase database) {
        this.database = database;
    }

    /**
     * 按条目存储顺序展开 tree 到 target，遇到子 tree 先展开完再继续同级条目。
     *
     * @return 写出的文件数
     * @throws CorruptObjectException 条目路径为空、含 "/" 或是 "." / ".."
     */
    public int materialize(Tree tree, Path target) throws IOException {
        int files = 0;
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(tree.getLeaves().iterator(), target));
        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (!top.leaves.hasNext()) {
                stack.pop();
                continue;
            }
            TreeLeaf leaf = top.leaves.next();
            Path dest = top.dir.resolve(checkedName(leaf));
            GitObject object = database.read(leaf.getOid());
            switch (object.getType()) {
                case TREE:
                    Files.createDirectory(dest);
                    log.debug("mkdir {}", dest);
                    stack.push(new Frame(((Tree) object).getLeaves().iterator(), dest));
                    break;
                case BLOB:
                    Files.write(dest, ((Blob) object).toBytes());
                    log.debug("wrote {} oid={}", dest, leaf.getOid());
                    files++;
                    break;
                default:
                    log.warn("skip {} entry {} ({})", object.getType(), leaf.getPath(), leaf.getOid());
            }
        }
        log.info("materialized {} files into {}", files, target);
        return files;
    }

    private static String checkedName(TreeLeaf leaf) throws CorruptObjectException {
        String name = leaf.getPath();
        if (name.isEmpty() || name.equals(".") || name.equals("..") || name.contains("/")) {
            throw new CorruptObjectException("unsafe tree entry name '" + name + "' for object " + leaf.getOid());
        }
        return name;
    }

    private static final class Frame {
        final Iterator<TreeLeaf> leaves;
        final Path dir;

        Frame(Iterator<TreeLeaf> leaves, Path dir) {
            this.leaves = leaves;
            this.dir = dir;
        }
    }
}
