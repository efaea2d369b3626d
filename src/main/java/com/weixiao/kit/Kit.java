package com.weixiao.kit;

import com.weixiao.kit.command.CatFileCommand;
import com.weixiao.kit.command.CheckoutCommand;
import com.weixiao.kit.command.HashObjectCommand;
import com.weixiao.kit.command.InitCommand;
import com.weixiao.kit.command.LogCommand;
import com.weixiao.kit.command.LsTreeCommand;
import com.weixiao.kit.command.ShowRefCommand;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * kit - 内容寻址对象库的命令行入口。
 * 通过子命令读写 .git 中的松散对象、解析引用、遍历提交历史与检出 tree。
 * <p>
 * 所有 kit 命令的执行都应通过此类作为唯一入口点。
 * 命令起始目录由本类的 -C / -d 统一提供，子命令通过 {@link #getStartPath()} 获取。
 */
@Command(name = "kit", mixinStandardHelpOptions = true, description = "kit - 内容寻址对象库")
public class Kit implements Runnable {

    @Option(names = {"-C", "-d", "--directory"}, paramLabel = "PATH",
            description = "以指定路径作为工作目录执行命令（默认为当前目录），子命令据此查找仓库根")
    private Path workingDirectory;

    /**
     * 未指定子命令时打印用法说明。
     */
    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    /**
     * 返回命令的起始路径（工作目录）。
     * init 在此路径下创建 .git；其余命令从此路径向上查找 .git 得到仓库根。
     *
     * @return 已规范化的绝对路径，不会为 null
     */
    public Path getStartPath() {
        Path base = workingDirectory != null ? workingDirectory : Paths.get("");
        return base.toAbsolutePath().normalize();
    }

    /**
     * 创建配置好的 CommandLine 实例，包含所有已注册的子命令。
     * 这是执行 kit 命令的统一入口点，供 main() 和测试使用。
     */
    public static CommandLine createCommandLine() {
        return new CommandLine(new Kit())
                .addSubcommand("init", new InitCommand())
                .addSubcommand("hash-object", new HashObjectCommand())
                .addSubcommand("cat-file", new CatFileCommand())
                .addSubcommand("log", new LogCommand())
                .addSubcommand("ls-tree", new LsTreeCommand())
                .addSubcommand("checkout", new CheckoutCommand())
                .addSubcommand("show-ref", new ShowRefCommand());
    }

    /**
     * 主入口方法，执行 kit 命令。
     * 若需调试日志：-Dkit.debug=true 或环境变量 KIT_DEBUG=true，或 -Dkit.log.level=DEBUG。
     */
    public static void main(String[] args) {
        if ("true".equalsIgnoreCase(System.getProperty("kit.debug"))
                || "true".equalsIgnoreCase(System.getenv("KIT_DEBUG"))) {
            System.setProperty("kit.log.level", "DEBUG");
        }
        CommandLine cli = createCommandLine();
        String[] runArgs = args != null && args.length > 0 ? args : new String[]{"--help"};
        int exitCode = cli.execute(runArgs);
        System.exit(exitCode);
    }
}
