package com.weixiao.kit.repo;

import com.weixiao.kit.errors.NotAFileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * .git 目录布局：把仓库内相对路径（如 "refs/heads/master"）映射到文件系统路径，
 * 并幂等地创建目录和文件。相对路径一律使用 "/" 分隔。
 */
public final class RepositoryLayout {

    private static final Logger log = LoggerFactory.getLogger(RepositoryLayout.class);

    private final Path gitDir;

    /**
     * 以给定的元数据根目录（通常是 worktree/.git）为基准。
     */
    public RepositoryLayout(Path gitDir) {
        this.gitDir = gitDir.toAbsolutePath().normalize();
    }

    public Path getGitDir() {
        return gitDir;
    }

    /**
     * 把相对路径拼到元数据根下，不做任何 I/O。空字符串得到根目录本身。
     */
    public Path resolve(String relative) {
        Path p = gitDir;
        for (String segment : segments(relative)) {
            p = p.resolve(segment);
        }
        return p;
    }

    /**
     * 从元数据根开始逐级检查 relative 的每一级目录。
     * 不存在时：create 为 true 则创建，否则跳过（视为暂不需要）；存在但不是目录时失败。
     * 可重复调用。
     *
     * @return relative 对应的绝对路径
     * @throws NotDirectoryException 某一级已存在但不是目录
     */
    public Path ensureDirectories(String relative, boolean create) throws IOException {
        Path current = gitDir;
        ensureDirectory(current, create);
        for (String segment : segments(relative)) {
            current = current.resolve(segment);
            ensureDirectory(current, create);
        }
        return current;
    }

    /**
     * 先确保父目录，再尝试新建文件。
     * 文件原本不存在且 create 为 true 时，新建并以读写方式打开，返回其 channel，由调用方负责关闭；
     * 文件已存在时返回 empty（不截断），调用方需自行以合适的方式打开已有文件；
     * create 为 false 且文件不存在时同样返回 empty，不产生任何副作用。
     *
     * @throws NotAFileException 目标路径已存在且是目录
     */
    public Optional<FileChannel> openOrCreateFile(String relative, boolean create) throws IOException {
        List<String> segments = segments(relative);
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("file path must not be empty");
        }
        ensureDirectories(String.join("/", segments.subList(0, segments.size() - 1)), create);

        Path file = resolve(relative);
        if (Files.isDirectory(file)) {
            throw new NotAFileException(file.toString());
        }
        if (Files.exists(file)) {
            log.debug("file already exists {}", file);
            return Optional.empty();
        }
        if (!create) {
            return Optional.empty();
        }
        try {
            FileChannel channel = FileChannel.open(file,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.READ, StandardOpenOption.WRITE);
            log.debug("created file {}", file);
            return Optional.of(channel);
        } catch (FileAlreadyExistsException e) {
            log.debug("file appeared concurrently {}", file);
            return Optional.empty();
        }
    }

    private static void ensureDirectory(Path dir, boolean create) throws IOException {
        if (Files.exists(dir)) {
            if (!Files.isDirectory(dir)) {
                throw new NotDirectoryException(dir.toString());
            }
            return;
        }
        if (create) {
            Files.createDirectory(dir);
            log.debug("created dir {}", dir);
        }
    }

    /** 拆分 "/" 分隔的相对路径，忽略首尾及重复的 "/"。 */
    private static List<String> segments(String relative) {
        List<String> out = new ArrayList<>();
        if (relative == null) return out;
        for (String s : relative.split("/")) {
            if (!s.isEmpty()) out.add(s);
        }
        return out;
    }
}
