package com.weixiao.kit.command;

import com.weixiao.kit.obj.GitObjects;
import com.weixiao.kit.obj.ObjectType;
import com.weixiao.kit.repo.ObjectDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * kit hash-object - 计算文件作为指定类型对象的 oid，-w 时写入对象库。
 * 文件内容会先按类型解析一遍，非法的 tree 内容或 tag 类型直接失败。
 */
@Command(name = "hash-object", mixinStandardHelpOptions = true, description = "计算对象 id，可选写入对象库")
public class HashObjectCommand extends KitCommand {

    private static final Logger log = LoggerFactory.getLogger(HashObjectCommand.class);

    @Option(names = "-w", description = "将对象写入对象库")
    private boolean write;

    @Option(names = "-t", paramLabel = "TYPE", defaultValue = "blob", converter = ObjectTypeConverter.class,
            description = "对象类型：blob、tree、commit，默认 blob")
    private ObjectType type;

    @Parameters(index = "0", paramLabel = "FILE", description = "要计算的文件")
    private Path file;

    @Override
    protected void execute() throws IOException {
        byte[] data = Files.readAllBytes(startPath().resolve(file));
        GitObjects.parse(type, data);

        String oid = write
                ? repository().getDatabase().write(type, data, true)
                : ObjectDatabase.hash(type, data);
        log.info("hash-object {} type={} oid={} written={}", file, type, oid, write);
        System.out.println(oid);
    }
}
