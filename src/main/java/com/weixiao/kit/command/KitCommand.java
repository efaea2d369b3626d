package com.weixiao.kit.command;

import com.weixiao.kit.Kit;
import com.weixiao.kit.repo.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.IExitCodeGenerator;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 子命令公共部分：从 {@link Kit} 取起始路径，执行 {@link #execute()}，
 * 把 IOException / IllegalArgumentException 转成 stderr 上的 "fatal: ..." 与退出码 1。
 */
abstract class KitCommand implements Runnable, IExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(KitCommand.class);

    @ParentCommand
    private Kit kit;

    private int exitCode = 0;

    /** 命令主体；失败时直接抛出异常。 */
    protected abstract void execute() throws IOException;

    @Override
    public final void run() {
        exitCode = 0;
        try {
            execute();
        } catch (IOException | IllegalArgumentException e) {
            log.error("{} failed", getClass().getSimpleName(), e);
            System.err.println("fatal: " + e.getMessage());
            exitCode = 1;
        }
    }

    /** 返回本命令的退出码（0 成功，1 失败）。 */
    @Override
    public int getExitCode() {
        return exitCode;
    }

    /** 命令起始目录；未经 Kit 调用时为当前目录。 */
    protected Path startPath() {
        return kit != null ? kit.getStartPath() : Path.of("").toAbsolutePath().normalize();
    }

    /** 从起始目录向上查找仓库，找不到时失败。 */
    protected Repository repository() throws IOException {
        return Repository.find(startPath(), true).orElseThrow();
    }
}
