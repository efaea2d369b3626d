package com.weixiao.kit.obj;

import com.weixiao.kit.errors.InvalidTreeLeafException;
import com.weixiao.kit.utils.HexUtils;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * tree 对象：目录快照。
 * 序列化：每条 mode + " " + path + "\0" + 20 字节二进制 oid，重复直到结尾。
 * 条目顺序与构造或解析时完全一致，不做排序。
 */
public final class Tree implements GitObject {

    private static final byte SPACE = ' ';
    private static final byte NUL = 0;
    private static final Pattern MODE_PATTERN = Pattern.compile("[0-9]{5,6}");

    private final List<TreeLeaf> leaves;

    /** 用给定条目构造 tree；null 视为空 tree。 */
    public Tree(List<TreeLeaf> leaves) {
        this.leaves = new ArrayList<>(leaves != null ? leaves : List.of());
    }

    /**
     * 解析 tree 对象体。空输入得到空 tree。
     *
     * @throws InvalidTreeLeafException 某条记录的 mode 不是 5/6 位数字、缺少 NUL 或 id 不足 20 字节
     */
    public static Tree parse(byte[] raw) throws InvalidTreeLeafException {
        List<TreeLeaf> leaves = new ArrayList<>();
        int pos = 0;
        while (pos < raw.length) {
            int space = indexOf(raw, SPACE, pos);
            if (space < 0) {
                throw new InvalidTreeLeafException(pos, "missing space after mode");
            }
            int modeLength = space - pos;
            if (modeLength != 5 && modeLength != 6) {
                throw new InvalidTreeLeafException(pos, "mode must be 5 or 6 bytes, got " + modeLength);
            }
            String mode = new String(raw, pos, modeLength, StandardCharsets.US_ASCII);
            if (!MODE_PATTERN.matcher(mode).matches()) {
                throw new InvalidTreeLeafException(pos, "mode must be digits, got '" + mode + "'");
            }

            int nul = indexOf(raw, NUL, space + 1);
            if (nul < 0) {
                throw new InvalidTreeLeafException(pos, "missing NUL after path");
            }
            String path = new String(raw, space + 1, nul - space - 1, StandardCharsets.UTF_8);

            int idStart = nul + 1;
            if (idStart + HexUtils.OID_RAW_LENGTH > raw.length) {
                throw new InvalidTreeLeafException(pos, "truncated object id for " + path);
            }
            String oid = HexUtils.bytesToHex(raw, idStart, HexUtils.OID_RAW_LENGTH);
            leaves.add(new TreeLeaf(mode, path, oid));
            pos = idStart + HexUtils.OID_RAW_LENGTH;
        }
        return new Tree(leaves);
    }

    @Override
    public ObjectType getType() {
        return ObjectType.TREE;
    }

    /**
     * 按存储顺序编码全部条目。
     *
     * @throws InvalidTreeLeafException                         某条目的 mode 不是 5/6 位数字，或 path 含 NUL 或 "/"
     * @throws com.weixiao.kit.errors.InvalidObjectIdException 某条目的 oid 不是 40 字符 hex
     */
    @Override
    public byte[] toBytes() throws InvalidTreeLeafException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (TreeLeaf leaf : leaves) {
            checkLeaf(leaf, out.size());
            byte[] oidBinary = HexUtils.hexToBytes(leaf.getOid());
            out.writeBytes(leaf.getMode().getBytes(StandardCharsets.US_ASCII));
            out.write(SPACE);
            out.writeBytes(leaf.getPath().getBytes(StandardCharsets.UTF_8));
            out.write(NUL);
            out.writeBytes(oidBinary);
        }
        return out.toByteArray();
    }

    /** 条目的只读视图，顺序即存储顺序。 */
    public List<TreeLeaf> getLeaves() {
        return Collections.unmodifiableList(leaves);
    }

    public boolean isEmpty() {
        return leaves.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tree)) return false;
        return leaves.equals(((Tree) o).leaves);
    }

    @Override
    public int hashCode() {
        return leaves.hashCode();
    }

    /** 写出前检查，保证编码结果能被 {@link #parse} 原样读回。 */
    private static void checkLeaf(TreeLeaf leaf, int offset) throws InvalidTreeLeafException {
        String mode = leaf.getMode();
        if (mode == null || !MODE_PATTERN.matcher(mode).matches()) {
            throw new InvalidTreeLeafException(offset, "mode must be 5 or 6 digits, got '" + mode + "'");
        }
        String path = leaf.getPath();
        if (path == null || path.indexOf('\0') >= 0 || path.indexOf('/') >= 0) {
            throw new InvalidTreeLeafException(offset, "path must not contain NUL or '/': '" + path + "'");
        }
    }

    private static int indexOf(byte[] a, byte b, int from) {
        for (int i = from; i < a.length; i++) if (a[i] == b) return i;
        return -1;
    }
}
