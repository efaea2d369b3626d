package com.weixiao.kit.obj;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Commit 测试")
class CommitTest {

    private static final String TREE = "4b825dc642cb6eb9a060e54bf8d69288fbee4904";
    private static final String AUTHOR = "u <u@local> 0 +0000";

    /**
     * 根提交没有 parent 行，body 为 tree、author、committer、空行、message。
     */
    @Test
    @DisplayName("根提交序列化格式")
    void rootCommit_format() {
        Commit commit = new Commit(TREE, List.of(), AUTHOR, AUTHOR, "first");
        assertThat(commit.getType()).isEqualTo(ObjectType.COMMIT);
        assertThat(new String(commit.toBytes(), StandardCharsets.UTF_8)).isEqualTo(
                "tree " + TREE + "\n"
                        + "author " + AUTHOR + "\n"
                        + "committer " + AUTHOR + "\n"
                        + "\n"
                        + "first");
        assertThat(commit.getParents()).isEmpty();
    }

    @Test
    @DisplayName("合并提交解析后读出两个 parent")
    void mergeCommit_parents() {
        String p1 = "1".repeat(40);
        String p2 = "2".repeat(40);
        Commit commit = Commit.parse(new Commit(TREE, List.of(p1, p2), AUTHOR, AUTHOR, "merge\n").toBytes());

        assertThat(commit.getTree()).isEqualTo(TREE);
        assertThat(commit.getParents()).containsExactly(p1, p2);
        assertThat(commit.getAuthor()).isEqualTo(AUTHOR);
        assertThat(commit.getCommitter()).isEqualTo(AUTHOR);
        assertThat(commit.getMessage()).isEqualTo("merge\n");
    }

    @Test
    @DisplayName("message 为 null 时当作空字符串")
    void nullMessage_isEmpty() {
        Commit commit = new Commit(TREE, List.of(), AUTHOR, AUTHOR, null);
        assertThat(commit.getMessage()).isEmpty();
        assertThat(Commit.parse(commit.toBytes())).isEqualTo(commit);
    }

    /**
     * 文本按 UTF-8 写入，读回时得到原来的字符串。
     */
    @Test
    @DisplayName("非 ASCII 作者与提交信息按 UTF-8 编码")
    void unicodeText_utf8() {
        Commit commit = new Commit(TREE, List.of(), "\u674e\u96f7 <l@local> 0 +0800", AUTHOR, "\u521d\u59cb\u63d0\u4ea4\n");
        Commit parsed = Commit.parse(commit.toBytes());

        assertThat(new String(commit.toBytes(), StandardCharsets.UTF_8))
                .contains("author \u674e\u96f7 <l@local>")
                .endsWith("\n\n\u521d\u59cb\u63d0\u4ea4\n");
        assertThat(parsed.getAuthor()).isEqualTo("\u674e\u96f7 <l@local> 0 +0800");
        assertThat(parsed.getMessage()).isEqualTo("\u521d\u59cb\u63d0\u4ea4\n");
    }

    /**
     * 声明了 encoding 的 commit 按该字符集解码，且重新序列化后字节不变（oid 不变）。
     */
    @Test
    @DisplayName("ISO-8859-1 commit 按 encoding 解码且字节不变")
    void latin1Commit_keepsBytes() {
        byte[] raw = ("tree " + TREE + "\n"
                + "author Ren\u00e9 <r@local> 0 +0100\n"
                + "committer Ren\u00e9 <r@local> 0 +0100\n"
                + "encoding ISO-8859-1\n"
                + "\n"
                + "caf\u00e9\n").getBytes(StandardCharsets.ISO_8859_1);

        Commit commit = Commit.parse(raw);

        assertThat(commit.toBytes()).isEqualTo(raw);
        assertThat(commit.getEncoding()).isEqualTo(StandardCharsets.ISO_8859_1);
        assertThat(commit.getAuthor()).isEqualTo("Ren\u00e9 <r@local> 0 +0100");
        assertThat(commit.getMessage()).isEqualTo("caf\u00e9\n");
    }

    @Test
    @DisplayName("缺少 tree、author 或 committer 时构造失败")
    void nullFields_rejected() {
        assertThatThrownBy(() -> new Commit(null, List.of(), AUTHOR, AUTHOR, "m"))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new Commit(TREE, List.of(), null, AUTHOR, "m"))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("author");
        assertThatThrownBy(() -> new Commit(TREE, List.of(), AUTHOR, null, "m"))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("committer");
    }
}
