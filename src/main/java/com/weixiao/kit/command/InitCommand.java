package com.weixiao.kit.command;

import com.weixiao.kit.repo.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * kit init - 在起始目录或指定路径创建空仓库：.git、branches、objects、refs/tags、refs/heads，
 * 以及 description、HEAD、config。重复执行不会覆盖已有文件。
 */
@Command(name = "init", mixinStandardHelpOptions = true, description = "创建空的 kit 仓库")
public class InitCommand extends KitCommand {

    private static final Logger log = LoggerFactory.getLogger(InitCommand.class);

    @Parameters(index = "0", arity = "0..1", description = "仓库根路径，默认为当前目录")
    private Path path;

    @Override
    protected void execute() throws IOException {
        Path root = path != null ? startPath().resolve(path).normalize() : startPath();
        boolean existed = Files.isDirectory(root.resolve(Repository.GIT_DIR));
        log.debug("init root={} existed={}", root, existed);

        Repository repo = Repository.create(root);
        System.out.println((existed ? "Reinitialized existing" : "Initialized empty")
                + " Kit repository in " + repo.getGitDir());
    }
}
