package com.weixiao.kit.obj;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Key-Value List with Message：commit 对象体的文本格式。
 * <pre>
 * tree 29ff16c9c14e2652b22f8b78bb08a5a07930c147
 * parent 206941306e8a8af65b66eaaaea388a7ae24d49a0
 * author Thibault Polge &lt;thibault@thb.lt&gt; 1527025023 +0200
 * gpgsig -----BEGIN PGP SIGNATURE-----
 *  (续行以一个空格开头)
 *
 * 提交信息
 * </pre>
 * 同一个 key 可以出现多次（如多个 parent），值按出现顺序保存；key 按首次出现顺序保存。
 * 提交信息保存在空字符串 key 下，序列化时总是放在最后。
 * <p>
 * 所有 key、value 都是"字节串"：按 ISO-8859-1 解码，一个 char 对应一个字节，
 * 因此任意编码（包括非 UTF-8）的 commit 都能逐字节还原。需要按文本读写时由 {@link Commit} 转换。
 */
public final class Kvlm {

    /** 提交信息所在的 key。 */
    public static final String MESSAGE_KEY = "";

    private static final byte SPACE = ' ';
    private static final byte LF = '\n';

    private final Map<String, List<String>> fields = new LinkedHashMap<>();

    /**
     * 追加一个值；key 第一次出现时记录其顺序。
     *
     * @throws NullPointerException     key 或 value 为 null
     * @throws IllegalArgumentException key 或 value 含有超出单字节范围的字符
     */
    public Kvlm add(String key, String value) {
        checkRaw(Objects.requireNonNull(key, "key"));
        checkRaw(Objects.requireNonNull(value, "value"));
        fields.computeIfAbsent(key, k -> new ArrayList<>(1)).add(value);
        return this;
    }

    /** key 对应的全部值，按出现顺序；不存在时返回空列表。 */
    public List<String> get(String key) {
        List<String> values = fields.get(key);
        return values != null ? Collections.unmodifiableList(values) : List.of();
    }

    /** key 对应的第一个值；不存在时返回 null。 */
    public String getFirst(String key) {
        List<String> values = fields.get(key);
        return values != null ? values.get(0) : null;
    }

    public boolean contains(String key) {
        return fields.containsKey(key);
    }

    /** 除提交信息外的 key，按首次出现顺序。 */
    public List<String> keys() {
        List<String> keys = new ArrayList<>(fields.keySet());
        keys.remove(MESSAGE_KEY);
        return keys;
    }

    /** 提交信息（空 key 下所有值的拼接）；没有时为 ""。 */
    public String getMessage() {
        return String.join("", get(MESSAGE_KEY));
    }

    /** 替换提交信息。 */
    public Kvlm setMessage(String message) {
        fields.remove(MESSAGE_KEY);
        return add(MESSAGE_KEY, message);
    }

    /**
     * 从 commit 对象体解析。单次从左到右扫描，不会失败：
     * 无法构成 "key value" 行的剩余部分整体视为提交信息。
     */
    public static Kvlm parse(byte[] raw) {
        Kvlm kvlm = new Kvlm();
        int pos = 0;
        while (pos < raw.length) {
            int spc = indexOf(raw, SPACE, pos);
            int nl = indexOf(raw, LF, pos);

            // 空行：header 结束，其后全部是提交信息
            if (nl == pos) {
                kvlm.add(MESSAGE_KEY, text(raw, pos + 1, raw.length));
                return kvlm;
            }
            // 本行没有 "key value" 结构，也当作提交信息
            if (spc < 0 || (nl >= 0 && nl < spc)) {
                kvlm.add(MESSAGE_KEY, text(raw, pos, raw.length));
                return kvlm;
            }

            String key = text(raw, pos, spc);

            // 换行后紧跟空格是续行，继续向后找真正的行尾
            int end = spc;
            do {
                end = indexOf(raw, LF, end + 1);
                if (end < 0) {
                    end = raw.length;
                    break;
                }
            } while (end + 1 < raw.length && raw[end + 1] == SPACE);

            String value = text(raw, spc + 1, end).replace("\n ", "\n");
            kvlm.add(key, value);
            pos = end + 1;
        }
        return kvlm;
    }

    /**
     * 序列化：非空 key 按首次出现顺序、每个值一行（值中的换行写成换行 + 空格），
     * 之后一个空行，再接提交信息。
     */
    public byte[] toBytes() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, List<String>> e : fields.entrySet()) {
            if (MESSAGE_KEY.equals(e.getKey())) continue;
            for (String value : e.getValue()) {
                sb.append(e.getKey()).append(' ').append(value.replace("\n", "\n ")).append('\n');
            }
        }
        sb.append('\n').append(getMessage());
        return sb.toString().getBytes(StandardCharsets.ISO_8859_1);
    }

    /** key 顺序和每个 key 下的值顺序都相同才相等。 */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Kvlm)) return false;
        Kvlm other = (Kvlm) o;
        return new ArrayList<>(fields.keySet()).equals(new ArrayList<>(other.fields.keySet()))
                && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "Kvlm" + fields;
    }

    private static void checkRaw(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) > 0xFF) {
                throw new IllegalArgumentException("kvlm text must be raw bytes, found '" + s.charAt(i) + "'");
            }
        }
    }

    private static String text(byte[] raw, int from, int to) {
        return new String(raw, from, to - from, StandardCharsets.ISO_8859_1);
    }

    private static int indexOf(byte[] a, byte b, int from) {
        for (int i = from; i < a.length; i++) if (a[i] == b) return i;
        return -1;
    }
}
