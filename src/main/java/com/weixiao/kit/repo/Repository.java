package com.weixiao.kit.repo;

import com.weixiao.kit.errors.NotARepositoryException;
import com.weixiao.kit.errors.UnsupportedConfigurationException;
import com.weixiao.kit.obj.Commit;
import com.weixiao.kit.obj.GitObject;
import com.weixiao.kit.obj.ObjectType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * 仓库：工作区根 + .git 元数据目录 + 配置，提供 RepositoryLayout、ObjectDatabase、Refs。
 * 只是一次命令调用内使用的句柄，不持有任何对象。
 */
public final class Repository {

    private static final Logger log = LoggerFactory.getLogger(Repository.class);

    public static final String GIT_DIR = ".git";
    public static final String CONFIG = "config";
    public static final String DESCRIPTION = "description";

    static final String DEFAULT_DESCRIPTION =
            "Unnamed repository; edit this file 'description' to name the repository.\n";
    static final String DEFAULT_HEAD = "ref: refs/heads/master\n";

    private static final List<String> LAYOUT_DIRS = List.of("branches", "objects", "refs/tags", "refs/heads");

    private final Path root;   // 工作区根
    private final Path gitDir; // .git 目录
    private final RepositoryConfig config;
    private final RepositoryLayout layout;
    private final ObjectDatabase database;
    private final Refs refs;

    private Repository(Path root, RepositoryConfig config) {
        this.root = root.toAbsolutePath().normalize();
        this.gitDir = this.root.resolve(GIT_DIR);
        this.config = config;
        this.layout = new RepositoryLayout(gitDir);
        this.database = new ObjectDatabase(layout);
        this.refs = new Refs(layout);
    }

    /**
     * 打开 worktree 处的仓库。
     * force 为 false 时要求 .git 是目录、config 可读且 core.repositoryformatversion 为 0；
     * force 为 true（仅 init 使用）时不做这些检查，config 读不到则为 null。
     *
     * @throws NotARepositoryException           .git 不存在或不是目录
     * @throws UnsupportedConfigurationException config 缺失、格式错误或版本不受支持
     */
    public static Repository open(Path worktree, boolean force) throws IOException {
        Path root = worktree.toAbsolutePath().normalize();
        Path gitDir = root.resolve(GIT_DIR);
        if (force) {
            Path configFile = gitDir.resolve(CONFIG);
            RepositoryConfig config = Files.isRegularFile(configFile) ? RepositoryConfig.load(configFile) : null;
            return new Repository(root, config);
        }
        if (!Files.isDirectory(gitDir)) {
            throw new NotARepositoryException(root);
        }
        RepositoryConfig config = RepositoryConfig.load(gitDir.resolve(CONFIG));
        int version = config.getRepositoryFormatVersion();
        if (version != 0) {
            throw new UnsupportedConfigurationException("unsupported repositoryformatversion " + version);
        }
        log.debug("opened repo root={}", root);
        return new Repository(root, config);
    }

    /**
     * 在 worktree 处创建仓库：.git 及 branches、objects、refs/tags、refs/heads 目录，
     * 以及 description、HEAD、config 三个文件。已存在的文件保持原样，因此重复执行是安全的。
     *
     * @throws NotDirectoryException worktree 或某个布局目录已存在但不是目录
     */
    public static Repository create(Path worktree) throws IOException {
        Path root = worktree.toAbsolutePath().normalize();
        if (Files.exists(root) && !Files.isDirectory(root)) {
            throw new NotDirectoryException(root.toString());
        }
        Files.createDirectories(root);

        Repository repo = open(root, true);
        RepositoryLayout layout = repo.getLayout();
        layout.ensureDirectories("", true);
        for (String dir : LAYOUT_DIRS) {
            layout.ensureDirectories(dir, true);
        }

        writeIfAbsent(layout, DESCRIPTION, DEFAULT_DESCRIPTION);
        writeIfAbsent(layout, Refs.HEAD, DEFAULT_HEAD);
        writeIfAbsent(layout, CONFIG, RepositoryConfig.defaults().toText());

        log.info("repository initialized at {}", repo.getGitDir());
        return open(root, false);
    }

    /**
     * 从 start 向上查找第一个包含 .git 目录的目录并打开。
     * 找到 .git 但配置不合法时直接失败，不会越过它继续向上查找。
     *
     * @param required 为 true 时找不到则抛出 NotARepositoryException，否则返回 empty
     */
    public static Optional<Repository> find(Path start, boolean required) throws IOException {
        Path current = start.toAbsolutePath().normalize();
        log.debug("find repo start={}", current);
        while (current != null) {
            if (Files.isDirectory(current.resolve(GIT_DIR))) {
                log.debug("found repo at {}", current);
                return Optional.of(open(current, false));
            }
            current = current.getParent();
        }
        log.debug("no repo found from {}", start);
        if (required) {
            throw new NotARepositoryException(start.toAbsolutePath().normalize());
        }
        return Optional.empty();
    }

    /**
     * 把名字（oid、HEAD、分支名、标签名或 refs/ 路径）解析为对象 oid。
     * expected 为 TREE 且名字指向 commit 时，返回该 commit 的 tree。
     */
    public String findObject(String name, ObjectType expected) throws IOException {
        String oid = refs.resolveName(name);
        if (expected == ObjectType.TREE) {
            GitObject object = database.read(oid);
            if (object instanceof Commit) {
                String tree = ((Commit) object).getTree();
                log.debug("followed commit {} to tree {}", oid, tree);
                return tree;
            }
        }
        return oid;
    }

    private static void writeIfAbsent(RepositoryLayout layout, String relative, String content) throws IOException {
        Optional<FileChannel> created = layout.openOrCreateFile(relative, true);
        if (created.isEmpty()) {
            log.debug("keep existing {}", relative);
            return;
        }
        try (OutputStream out = Channels.newOutputStream(created.get())) {
            out.write(content.getBytes(StandardCharsets.UTF_8));
        }
        log.debug("wrote {}", relative);
    }

    /**
     * 工作区根目录。
     */
    public Path getRoot() {
        return root;
    }

    /**
     * .git 目录路径。
     */
    public Path getGitDir() {
        return gitDir;
    }

    /**
     * 仓库配置；以 force 打开且 config 不存在时为 null。
     */
    public RepositoryConfig getConfig() {
        return config;
    }

    public RepositoryLayout getLayout() {
        return layout;
    }

    /**
     * 对象库，用于读写 blob、tree、commit。
     */
    public ObjectDatabase getDatabase() {
        return database;
    }

    /**
     * 引用，用于解析 HEAD、分支与标签。
     */
    public Refs getRefs() {
        return refs;
    }
}
