package com.weixiao.kit;

import com.weixiao.kit.obj.Blob;
import com.weixiao.kit.obj.Commit;
import com.weixiao.kit.obj.Tree;
import com.weixiao.kit.obj.TreeLeaf;
import com.weixiao.kit.repo.ObjectDatabase;
import com.weixiao.kit.repo.Repository;
import lombok.Value;
import lombok.experimental.UtilityClass;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * kit 测试用工具方法，供各命令测试类复用。
 */
@UtilityClass
public class KitTestUtil {

    public static final String IDENT = "Kit Tester <tester@example.com> 1700000000 +0800";

    /**
     * 用新的 {@link Kit#createCommandLine()} 执行命令，重定向 stdout/stderr 并在结束后恢复。
     *
     * @param args 命令参数（如 "-C", dir, "init"）
     * @return 退出码、标准输出、标准错误
     */
    public static ExecuteResult execute(String... args) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        PrintStream origOut = System.out;
        PrintStream origErr = System.err;
        PrintStream captureOut = new PrintStream(out, true, StandardCharsets.UTF_8);
        PrintStream captureErr = new PrintStream(err, true, StandardCharsets.UTF_8);
        System.setOut(captureOut);
        System.setErr(captureErr);
        try {
            int exitCode = Kit.createCommandLine().execute(args);
            captureOut.flush();
            captureErr.flush();
            return new ExecuteResult(exitCode, out.toByteArray(), err.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(origOut);
            System.setErr(origErr);
        }
    }

    /**
     * 在 dir 创建仓库并写入一个提交：README 与 src/main.c，master 指向该提交。
     * 示例：返回的 Fixture 中 commit 即 HEAD 解析结果。
     */
    public static Fixture createRepoWithCommit(Path dir) throws IOException {
        Repository repo = Repository.create(dir);
        ObjectDatabase db = repo.getDatabase();
        String readme = db.store(new Blob("hello\n".getBytes(StandardCharsets.UTF_8)));
        String main = db.store(new Blob("int main() {}\n".getBytes(StandardCharsets.UTF_8)));
        String src = db.store(new Tree(List.of(TreeLeaf.regularFile("main.c", main))));
        String tree = db.store(new Tree(List.of(
                TreeLeaf.regularFile("README", readme),
                TreeLeaf.directory("src", src))));
        String commit = db.store(new Commit(tree, List.of(), IDENT, IDENT, "initial\n"));
        Files.writeString(repo.getGitDir().resolve("refs").resolve("heads").resolve("master"), commit + "\n");
        return new Fixture(repo, commit, tree, readme, src);
    }

    /** 执行结果：退出码 + 标准输出（原始字节）+ 标准错误 */
    @Value
    public static class ExecuteResult {
        int exitCode;
        byte[] rawOutput;
        String err;

        public String getOutput() {
            return new String(rawOutput, StandardCharsets.UTF_8);
        }
    }

    /** 测试仓库及其中各对象的 oid */
    @Value
    public static class Fixture {
        Repository repo;
        String commit;
        String tree;
        String readme;
        String src;
    }
}
