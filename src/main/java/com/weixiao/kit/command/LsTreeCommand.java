package com.weixiao.kit.command;

import com.weixiao.kit.obj.ObjectType;
import com.weixiao.kit.obj.Tree;
import com.weixiao.kit.obj.TreeLeaf;
import com.weixiao.kit.repo.ObjectDatabase;
import com.weixiao.kit.repo.Repository;
import picocli.CommandLine.*;

import java.io.IOException;

/**
 * kit ls-tree - 列出 tree 的条目：mode（补零到 6 位）、子对象类型、oid、路径。
 */
@Command(name = "ls-tree", mixinStandardHelpOptions = true, description = "列出 tree 对象内容")
public class LsTreeCommand extends KitCommand {

    @Parameters(index = "0", paramLabel = "TREE", description = "tree 或 commit 的 id / 引用名")
    private String tree;

    @Override
    protected void execute() throws IOException {
        Repository repo = repository();
        ObjectDatabase db = repo.getDatabase();
        Tree t = db.readTree(repo.findObject(tree, ObjectType.TREE));

        StringBuilder sb = new StringBuilder();
        for (TreeLeaf leaf : t.getLeaves()) {
            ObjectType childType = db.load(leaf.getOid()).getType();
            sb.append(leaf.paddedMode()).append(' ')
                    .append(childType.getTypeName()).append(' ')
                    .append(leaf.getOid()).append('\t')
                    .append(leaf.getPath()).append('\n');
        }
        System.out.print(sb);
    }
}
