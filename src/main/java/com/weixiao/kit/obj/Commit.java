package com.weixiao.kit.obj;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.List;
import java.util.Objects;

/**
 * commit 对象：对象体是一个 {@link Kvlm}。
 * 常用字段 tree、parent（零个或多个）、author、committer 和提交信息都从 kvlm 读取，
 * 其他字段（如 gpgsig、encoding）原样保留。
 * <p>
 * kvlm 中保存的是原始字节；author、committer、提交信息按 encoding 字段声明的字符集解码，
 * 没有声明时按 UTF-8。
 */
public final class Commit implements GitObject {

    public static final String TREE = "tree";
    public static final String PARENT = "parent";
    public static final String AUTHOR = "author";
    public static final String COMMITTER = "committer";
    public static final String ENCODING = "encoding";

    private final Kvlm kvlm;

    /** 直接包装一个已解析的 kvlm。 */
    public Commit(Kvlm kvlm) {
        this.kvlm = kvlm;
    }

    /**
     * 用 tree、父提交列表、作者、提交者、提交信息构造 commit，文本按 UTF-8 编码。
     * parents 为空表示根提交，message 为 null 时当作空字符串。
     *
     * @throws NullPointerException treeOid、parents、author 或 committer 为 null
     */
    public Commit(String treeOid, List<String> parents, String author, String committer, String message) {
        Objects.requireNonNull(treeOid, "treeOid");
        Objects.requireNonNull(parents, "parents");
        Objects.requireNonNull(author, "author");
        Objects.requireNonNull(committer, "committer");
        this.kvlm = new Kvlm().add(TREE, treeOid);
        for (String parent : parents) {
            kvlm.add(PARENT, Objects.requireNonNull(parent, "parent"));
        }
        kvlm.add(AUTHOR, raw(author))
                .add(COMMITTER, raw(committer))
                .setMessage(raw(message != null ? message : ""));
    }

    /** 解析 commit 对象体。 */
    public static Commit parse(byte[] payload) {
        return new Commit(Kvlm.parse(payload));
    }

    @Override
    public ObjectType getType() {
        return ObjectType.COMMIT;
    }

    @Override
    public byte[] toBytes() {
        return kvlm.toBytes();
    }

    public Kvlm getKvlm() {
        return kvlm;
    }

    /** 根 tree 的 oid；缺失时为 null。 */
    public String getTree() {
        return kvlm.getFirst(TREE);
    }

    /** 父提交 oid，按出现顺序；根提交为空列表。 */
    public List<String> getParents() {
        return kvlm.get(PARENT);
    }

    public String getAuthor() {
        return decode(kvlm.getFirst(AUTHOR));
    }

    public String getCommitter() {
        return decode(kvlm.getFirst(COMMITTER));
    }

    public String getMessage() {
        return decode(kvlm.getMessage());
    }

    /** encoding 字段声明的字符集；未声明或不认识时为 UTF-8。 */
    public Charset getEncoding() {
        String name = kvlm.getFirst(ENCODING);
        if (name == null) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(name.trim());
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            return StandardCharsets.UTF_8;
        }
    }

    private String decode(String rawValue) {
        if (rawValue == null) {
            return null;
        }
        return new String(rawValue.getBytes(StandardCharsets.ISO_8859_1), getEncoding());
    }

    private static String raw(String text) {
        return new String(text.getBytes(StandardCharsets.UTF_8), StandardCharsets.ISO_8859_1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Commit)) return false;
        return kvlm.equals(((Commit) o).kvlm);
    }

    @Override
    public int hashCode() {
        return kvlm.hashCode();
    }
}
