package com.weixiao.kit.repo;

import com.weixiao.kit.errors.MissingRefException;
import com.weixiao.kit.errors.SymbolicRefLoopException;
import com.weixiao.kit.utils.HexUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 引用：解析 HEAD、refs/heads/*、refs/tags/* 等引用文件，支持 "ref: " 符号引用。
 */
public final class Refs {

    private static final Logger log = LoggerFactory.getLogger(Refs.class);

    public static final String HEAD = "HEAD";
    public static final String REFS = "refs";
    public static final String REFS_HEADS = "refs/heads/";
    public static final String REFS_TAGS = "refs/tags/";

    /** 符号引用最多间接的层数。 */
    public static final int MAX_SYMBOLIC_REF_DEPTH = 5;

    private static final String SYMREF_PREFIX = "ref: ";

    private final RepositoryLayout layout;

    /**
     * 以 .git 目录布局为基准，引用路径均相对于 .git。
     */
    public Refs(RepositoryLayout layout) {
        this.layout = layout;
    }

    /**
     * 把引用文件解析为最终的 oid。
     * 内容以 "ref: " 开头时继续解析其指向的引用；否则内容（去掉末尾换行）即为 oid。
     *
     * @throws MissingRefException       链上某个引用文件不存在
     * @throws SymbolicRefLoopException 符号引用成环或超过 {@link #MAX_SYMBOLIC_REF_DEPTH} 层
     */
    public String resolve(String refPath) throws IOException {
        Set<String> seen = new HashSet<>();
        String current = refPath;
        for (int depth = 0; depth <= MAX_SYMBOLIC_REF_DEPTH; depth++) {
            if (!seen.add(current)) {
                throw new SymbolicRefLoopException(refPath, depth);
            }
            String content = read(current);
            if (!content.startsWith(SYMREF_PREFIX)) {
                log.debug("resolved {} -> {} depth={}", refPath, content, depth);
                return content;
            }
            current = content.substring(SYMREF_PREFIX.length());
        }
        throw new SymbolicRefLoopException(refPath, MAX_SYMBOLIC_REF_DEPTH);
    }

    /**
     * 递归列出 subtree（如 "refs"）下的全部引用，深度优先，同一目录内按文件名排序。
     */
    public List<Ref> list(String subtree) throws IOException {
        List<Ref> refs = new ArrayList<>();
        Path dir = layout.resolve(subtree);
        if (!Files.isDirectory(dir)) {
            log.debug("no refs under {}", subtree);
            return refs;
        }
        collect(trimSlashes(subtree), dir, refs);
        return refs;
    }

    /**
     * 把用户给出的名字解析为 oid：40 位 hex 原样返回；
     * 否则依次尝试 name（仅限 HEAD 这类全大写名字或 refs/ 开头的完整路径）、refs/name、refs/tags/name、refs/heads/name。
     *
     * @throws MissingRefException 所有候选都不存在
     */
    public String resolveName(String name) throws IOException {
        if (HexUtils.isObjectId(name)) {
            return name;
        }
        for (String candidate : candidates(name)) {
            if (Files.isRegularFile(layout.resolve(candidate))) {
                log.debug("name {} matched ref {}", name, candidate);
                return resolve(candidate);
            }
        }
        throw new MissingRefException(name);
    }

    private List<String> candidates(String name) {
        List<String> out = new ArrayList<>();
        if (name.startsWith(REFS + "/") || name.matches("[A-Z_]+")) {
            out.add(name);
        }
        out.add(REFS + "/" + name);
        out.add(REFS_TAGS + name);
        out.add(REFS_HEADS + name);
        return out;
    }

    private void collect(String prefix, Path dir, List<Ref> refs) throws IOException {
        List<Path> children;
        try (Stream<Path> stream = Files.list(dir)) {
            children = stream.sorted().collect(Collectors.toList());
        }
        for (Path child : children) {
            String name = child.getFileName().toString();
            String relative = prefix.isEmpty() ? name : prefix + "/" + name;
            if (Files.isDirectory(child)) {
                collect(relative, child, refs);
            } else {
                refs.add(new Ref(resolve(relative), relative));
            }
        }
    }

    /** 读取引用文件内容并去掉末尾的一个换行。 */
    private String read(String refPath) throws IOException {
        Path file = layout.resolve(refPath);
        if (!Files.isRegularFile(file)) {
            throw new MissingRefException(refPath);
        }
        String content = Files.readString(file, StandardCharsets.UTF_8);
        if (content.endsWith("\n")) {
            content = content.substring(0, content.length() - 1);
        }
        return content;
    }

    private static String trimSlashes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '/') start++;
        while (end > start && s.charAt(end - 1) == '/') end--;
        return s.substring(start, end);
    }
}
