package com.weixiao.kit.command;

import com.weixiao.kit.obj.ObjectType;
import com.weixiao.kit.obj.Tree;
import com.weixiao.kit.repo.Repository;
import com.weixiao.kit.walk.TreeMaterializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.*;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * kit checkout - 把提交（或 tree）的内容展开到一个不存在或为空的目录。
 */
@Command(name = "checkout", mixinStandardHelpOptions = true, description = "将提交检出到空目录")
public class CheckoutCommand extends KitCommand {

    private static final Logger log = LoggerFactory.getLogger(CheckoutCommand.class);

    @Parameters(index = "0", paramLabel = "COMMIT", description = "提交或 tree 的 id / 引用名")
    private String commit;

    @Parameters(index = "1", paramLabel = "PATH", description = "目标目录，必须不存在或为空")
    private Path path;

    @Override
    protected void execute() throws IOException {
        Repository repo = repository();
        Tree tree = repo.getDatabase().readTree(repo.findObject(commit, ObjectType.TREE));

        Path target = startPath().resolve(path).normalize();
        prepareTarget(target);
        int files = new TreeMaterializer(repo.getDatabase()).materialize(tree, target);
        log.info("checkout {} into {} files={}", commit, target, files);
    }

    /** 目标不存在时创建；存在时必须是空目录，避免混入无关的工作区。 */
    private static void prepareTarget(Path target) throws IOException {
        if (!Files.exists(target)) {
            Files.createDirectories(target);
            return;
        }
        if (!Files.isDirectory(target)) {
            throw new NotDirectoryException(target.toString());
        }
        try (Stream<Path> entries = Files.list(target)) {
            if (entries.findAny().isPresent()) {
                throw new DirectoryNotEmptyException(target.toString());
            }
        }
    }
}
