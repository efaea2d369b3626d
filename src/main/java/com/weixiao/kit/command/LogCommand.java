package com.weixiao.kit.command;

import com.weixiao.kit.repo.Repository;
import com.weixiao.kit.walk.AncestryWalker;
import com.weixiao.kit.walk.Edge;
import picocli.CommandLine.*;

import java.io.IOException;
import java.util.List;

/**
 * kit log - 以 Graphviz digraph 输出提交历史，每条父子关系一行 "c_子 -> c_父"。
 */
@Command(name = "log", mixinStandardHelpOptions = true, description = "以 Graphviz 格式输出提交历史")
public class LogCommand extends KitCommand {

    @Parameters(index = "0", arity = "0..1", paramLabel = "COMMIT", defaultValue = "HEAD",
            description = "起始提交，默认为 HEAD")
    private String commit;

    @Override
    protected void execute() throws IOException {
        Repository repo = repository();
        String start = repo.getRefs().resolveName(commit);
        List<Edge> edges = new AncestryWalker(repo.getDatabase()).walk(start);

        StringBuilder sb = new StringBuilder("digraph kitlog{\n");
        for (Edge e : edges) {
            sb.append("c_").append(e.getChild()).append(" -> c_").append(e.getParent()).append('\n');
        }
        sb.append("}");
        System.out.println(sb);
    }
}
