package com.weixiao.kit.repo;

import com.weixiao.kit.errors.UnsupportedConfigurationException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * .git/config：INI 风格的 [section] + key = value。
 * section 与 key 不区分大小写；仓库只依赖 core.repositoryformatversion。
 */
public final class RepositoryConfig {

    public static final String CORE = "core";
    public static final String REPOSITORY_FORMAT_VERSION = "repositoryformatversion";

    private final Map<String, Map<String, String>> sections = new LinkedHashMap<>();

    /**
     * 新仓库的默认配置：repositoryformatversion = 0，filemode = false，bare = false。
     */
    public static RepositoryConfig defaults() {
        return new RepositoryConfig()
                .set(CORE, REPOSITORY_FORMAT_VERSION, "0")
                .set(CORE, "filemode", "false")
                .set(CORE, "bare", "false");
    }

    /**
     * 读取并解析配置文件。
     *
     * @throws UnsupportedConfigurationException 文件不存在、不可读或格式错误
     */
    public static RepositoryConfig load(Path file) throws UnsupportedConfigurationException {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UnsupportedConfigurationException("missing config file " + file, e);
        }
        return parse(lines);
    }

    /**
     * 解析 INI 文本行；# 与 ; 开头的行是注释。
     *
     * @throws UnsupportedConfigurationException 出现 section 之外的 key，或无法识别的行
     */
    public static RepositoryConfig parse(List<String> lines) throws UnsupportedConfigurationException {
        RepositoryConfig config = new RepositoryConfig();
        String section = null;
        int lineNo = 0;
        for (String raw : lines) {
            lineNo++;
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) continue;
            if (line.startsWith("[") && line.endsWith("]")) {
                section = line.substring(1, line.length() - 1).trim();
                config.sections.computeIfAbsent(normalize(section), k -> new LinkedHashMap<>());
                continue;
            }
            if (section == null) {
                throw new UnsupportedConfigurationException("config line " + lineNo + " is outside any section");
            }
            int eq = line.indexOf('=');
            if (eq < 0) {
                // 只有 key 没有值，按 git 的约定视为 true
                config.set(section, line, "true");
            } else {
                config.set(section, line.substring(0, eq).trim(), line.substring(eq + 1).trim());
            }
        }
        return config;
    }

    /** 读取 section.key 的值。 */
    public Optional<String> get(String section, String key) {
        Map<String, String> values = sections.get(normalize(section));
        return values == null ? Optional.empty() : Optional.ofNullable(values.get(normalize(key)));
    }

    /**
     * 读取整数值。
     *
     * @throws UnsupportedConfigurationException 缺失或不是整数
     */
    public int getInt(String section, String key) throws UnsupportedConfigurationException {
        String value = get(section, key)
                .orElseThrow(() -> new UnsupportedConfigurationException("missing " + section + "." + key));
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new UnsupportedConfigurationException("invalid " + section + "." + key + ": " + value, e);
        }
    }

    public int getRepositoryFormatVersion() throws UnsupportedConfigurationException {
        return getInt(CORE, REPOSITORY_FORMAT_VERSION);
    }

    /** 设置 section.key，保持首次出现顺序。 */
    public RepositoryConfig set(String section, String key, String value) {
        sections.computeIfAbsent(normalize(section), k -> new LinkedHashMap<>()).put(normalize(key), value);
        return this;
    }

    /** 序列化为 git 风格的文本：section 头顶格，key 以制表符缩进。 */
    public String toText() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Map<String, String>> s : sections.entrySet()) {
            sb.append('[').append(s.getKey()).append("]\n");
            for (Map.Entry<String, String> e : s.getValue().entrySet()) {
                sb.append('\t').append(e.getKey()).append(" = ").append(e.getValue()).append('\n');
            }
        }
        return sb.toString();
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
