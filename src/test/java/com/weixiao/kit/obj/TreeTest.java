package com.weixiao.kit.obj;

import com.weixiao.kit.errors.InvalidObjectIdException;
import com.weixiao.kit.errors.InvalidTreeLeafException;
import com.weixiao.kit.utils.HexUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Tree 测试")
class TreeTest {

    private static final String HELLO_OID = "ce013625030ba8dba906f756967f9e9ca394464a";
    private static final String OID_A = "a".repeat(40);
    private static final String OID_B = "0123456789abcdef0123456789abcdef01234567";

    /**
     * 序列化再解析得到相同条目，且保持原顺序（不排序）。
     * 示例：[b.txt, a.txt, dir] → toBytes → parse → 仍为 [b.txt, a.txt, dir]。
     */
    @Test
    @DisplayName("序列化后解析得到相同条目且顺序不变")
    void roundTrip_preservesOrder() throws Exception {
        List<TreeLeaf> leaves = List.of(
                TreeLeaf.regularFile("b.txt", OID_A),
                new TreeLeaf(TreeLeaf.MODE_EXECUTABLE, "a.sh", OID_B),
                TreeLeaf.directory("dir", HELLO_OID));
        Tree parsed = Tree.parse(new Tree(leaves).toBytes());
        assertThat(parsed.getLeaves()).containsExactlyElementsOf(leaves);
        assertThat(parsed).isEqualTo(new Tree(leaves));
    }

    /**
     * 单条记录的字节布局："100644 hello.txt\0" + 20 字节二进制 oid。
     */
    @Test
    @DisplayName("单条记录编码为 mode SP path NUL 20 字节 id")
    void toBytes_layout() throws Exception {
        byte[] bytes = new Tree(List.of(TreeLeaf.regularFile("hello.txt", HELLO_OID))).toBytes();
        byte[] header = "100644 hello.txt\0".getBytes(StandardCharsets.US_ASCII);
        assertThat(bytes).hasSize(header.length + 20);
        assertThat(bytes).startsWith(header);
        assertThat(HexUtils.bytesToHex(bytes, header.length, 20)).isEqualTo(HELLO_OID);
    }

    @Test
    @DisplayName("空 tree 编码为空字节，解析得到空列表")
    void emptyTree() throws Exception {
        assertThat(new Tree(List.of()).toBytes()).isEmpty();
        assertThat(Tree.parse(new byte[0]).getLeaves()).isEmpty();
        assertThat(Tree.parse(new byte[0]).isEmpty()).isTrue();
    }

    /**
     * 5 位 mode（git 对目录使用 "40000"）原样保留，不补零。
     */
    @Test
    @DisplayName("5 位 mode 原样保留")
    void fiveDigitMode_preserved() throws Exception {
        Tree parsed = Tree.parse(new Tree(List.of(TreeLeaf.directory("src", OID_A))).toBytes());
        assertThat(parsed.getLeaves().get(0).getMode()).isEqualTo("40000");
        assertThat(parsed.getLeaves().get(0).paddedMode()).isEqualTo("040000");
    }

    @Test
    @DisplayName("路径按 UTF-8 解码，可含空格")
    void path_utf8WithSpaces() throws Exception {
        TreeLeaf leaf = TreeLeaf.regularFile("我的 文件.txt", OID_B);
        assertThat(Tree.parse(new Tree(List.of(leaf)).toBytes()).getLeaves()).containsExactly(leaf);
    }

    /**
     * mode 长度不是 5 或 6 时失败。
     * 示例："1006 a\0" + 20 字节 → InvalidTreeLeafException。
     */
    @Test
    @DisplayName("mode 长度不是 5/6 时抛出 InvalidTreeLeafException")
    void badModeLength_fails() {
        byte[] raw = concat("1006 a\0".getBytes(StandardCharsets.US_ASCII), HexUtils.hexToBytes(OID_A));
        assertThatThrownBy(() -> Tree.parse(raw))
                .isInstanceOf(InvalidTreeLeafException.class)
                .hasMessageContaining("offset 0");
    }

    @Test
    @DisplayName("第二条记录损坏时报告其偏移")
    void secondLeafBroken_reportsOffset() throws Exception {
        byte[] first = new Tree(List.of(TreeLeaf.regularFile("a", OID_A))).toBytes();
        byte[] raw = concat(first, "1234567 b\0".getBytes(StandardCharsets.US_ASCII));
        assertThatThrownBy(() -> Tree.parse(raw))
                .isInstanceOfSatisfying(InvalidTreeLeafException.class,
                        e -> assertThat(e.getOffset()).isEqualTo(first.length));
    }

    @Test
    @DisplayName("缺少 NUL 或 id 不足 20 字节时失败")
    void truncated_fails() {
        assertThatThrownBy(() -> Tree.parse("100644 name-without-nul".getBytes(StandardCharsets.US_ASCII)))
                .isInstanceOf(InvalidTreeLeafException.class);
        assertThatThrownBy(() -> Tree.parse("100644 a\0short".getBytes(StandardCharsets.US_ASCII)))
                .isInstanceOf(InvalidTreeLeafException.class);
        assertThatThrownBy(() -> Tree.parse("100644".getBytes(StandardCharsets.US_ASCII)))
                .isInstanceOf(InvalidTreeLeafException.class);
    }

    @Test
    @DisplayName("条目 oid 不是 40 位 hex 时序列化失败")
    void invalidSha_failsOnSerialize() {
        assertThatThrownBy(() -> new Tree(List.of(TreeLeaf.regularFile("a", "xyz"))).toBytes())
                .isInstanceOf(InvalidObjectIdException.class);
        assertThatThrownBy(() -> new Tree(List.of(TreeLeaf.regularFile("a", "g".repeat(40)))).toBytes())
                .isInstanceOf(InvalidObjectIdException.class);
    }

    /**
     * 编码前校验条目，避免写出 parse 读回时含义不同的字节。
     * 示例：path "a\0b" 编码后会被 parse 截断成 "a"，因此直接拒绝。
     */
    @Test
    @DisplayName("mode 或 path 非法时序列化失败")
    void invalidLeaf_failsOnSerialize() {
        assertThatThrownBy(() -> new Tree(List.of(TreeLeaf.regularFile("a\0b", OID_A))).toBytes())
                .isInstanceOf(InvalidTreeLeafException.class);
        assertThatThrownBy(() -> new Tree(List.of(TreeLeaf.regularFile("dir/file", OID_A))).toBytes())
                .isInstanceOf(InvalidTreeLeafException.class);
        assertThatThrownBy(() -> new Tree(List.of(new TreeLeaf("1006", "a", OID_A))).toBytes())
                .isInstanceOf(InvalidTreeLeafException.class);
        assertThatThrownBy(() -> new Tree(List.of(new TreeLeaf("10 644", "a", OID_A))).toBytes())
                .isInstanceOf(InvalidTreeLeafException.class);
    }

    @Test
    @DisplayName("第二条记录非法时报告其在输出中的偏移")
    void invalidSecondLeaf_reportsOffset() throws Exception {
        int firstLength = new Tree(List.of(TreeLeaf.regularFile("a", OID_A))).toBytes().length;
        Tree tree = new Tree(List.of(TreeLeaf.regularFile("a", OID_A), new TreeLeaf("abcde", "b", OID_A)));

        assertThatThrownBy(tree::toBytes)
                .isInstanceOfSatisfying(InvalidTreeLeafException.class,
                        e -> assertThat(e.getOffset()).isEqualTo(firstLength));
    }

    @Test
    @DisplayName("mode 含非数字字符时解析失败")
    void nonDigitMode_failsOnParse() {
        byte[] raw = concat("1a064 a\0".getBytes(StandardCharsets.US_ASCII), HexUtils.hexToBytes(OID_A));
        assertThatThrownBy(() -> Tree.parse(raw)).isInstanceOf(InvalidTreeLeafException.class);
    }

    private static byte[] concat(byte[] a, byte[] b) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(a);
        out.writeBytes(b);
        return out.toByteArray();
    }
}
