package com.weixiao.kit.command;

import com.weixiao.kit.repo.Ref;
import com.weixiao.kit.repo.Refs;
import picocli.CommandLine.*;

import java.io.IOException;

/**
 * kit show-ref - 列出 refs/ 下的全部引用："oid path"。
 */
@Command(name = "show-ref", mixinStandardHelpOptions = true, description = "列出引用")
public class ShowRefCommand extends KitCommand {

    @Override
    protected void execute() throws IOException {
        StringBuilder sb = new StringBuilder();
        for (Ref ref : repository().getRefs().list(Refs.REFS)) {
            sb.append(ref.getOid()).append(' ').append(ref.getPath()).append('\n');
        }
        System.out.print(sb);
    }
}
