package com.weixiao.kit.command;

import com.weixiao.kit.obj.GitObject;
import com.weixiao.kit.obj.ObjectType;
import com.weixiao.kit.repo.Repository;
import picocli.CommandLine.*;

import java.io.IOException;

/**
 * kit cat-file - 输出对象体字节；对象类型与 TYPE 不一致时失败（TYPE 为 tree 时 commit 会被跟随到其 tree）。
 */
@Command(name = "cat-file", mixinStandardHelpOptions = true, description = "输出对象内容")
public class CatFileCommand extends KitCommand {

    @Parameters(index = "0", paramLabel = "TYPE", converter = ObjectTypeConverter.class,
            description = "期望的对象类型：blob、tree、commit")
    private ObjectType type;

    @Parameters(index = "1", paramLabel = "OBJECT", description = "对象 id 或引用名")
    private String object;

    @Override
    protected void execute() throws IOException {
        Repository repo = repository();
        String oid = repo.findObject(object, type);
        GitObject obj = repo.getDatabase().read(oid, type);
        System.out.write(obj.toBytes());
        System.out.flush();
    }
}
