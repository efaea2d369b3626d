package com.weixiao.kit.repo;

import com.weixiao.kit.errors.CorruptObjectException;
import com.weixiao.kit.errors.InvalidObjectIdException;
import com.weixiao.kit.errors.MalformedLengthException;
import com.weixiao.kit.errors.MissingObjectException;
import com.weixiao.kit.errors.UnexpectedObjectTypeException;
import com.weixiao.kit.obj.Blob;
import com.weixiao.kit.obj.Commit;
import com.weixiao.kit.obj.GitObject;
import com.weixiao.kit.obj.GitObjects;
import com.weixiao.kit.obj.ObjectType;
import com.weixiao.kit.obj.Tree;
import com.weixiao.kit.utils.HexUtils;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.regex.Pattern;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.InflaterInputStream;

/**
 * .git/objects 松散对象存储：按 oid 写入/读取对象，格式与 Git 一致（type size\0body，zlib 压缩）。
 * 路径为 objects/前 2 位/后 38 位。
 */
public final class ObjectDatabase {

    private static final Logger log = LoggerFactory.getLogger(ObjectDatabase.class);

    static final String OBJECTS_DIR = "objects";
    static final String TEMP_PREFIX = "tmp_obj_";

    /** 十进制长度：只有数字，除 "0" 外不能以 0 开头。 */
    private static final Pattern CANONICAL_LENGTH = Pattern.compile("0|[1-9][0-9]*");

    private final RepositoryLayout layout;

    /**
     * 以仓库布局为基准，对象存储路径为 .git/objects。
     */
    public ObjectDatabase(RepositoryLayout layout) {
        this.layout = layout;
    }

    /**
     * 构造分帧字节："type size\0body"，size 为 body 字节数的十进制。
     */
    public static byte[] frame(ObjectType type, byte[] body) {
        byte[] header = (type.getTypeName() + " " + body.length + "\0").getBytes(StandardCharsets.US_ASCII);
        byte[] content = new byte[header.length + body.length];
        System.arraycopy(header, 0, content, 0, header.length);
        System.arraycopy(body, 0, content, header.length, body.length);
        return content;
    }

    /**
     * 只计算 oid，不写入，不需要仓库。
     */
    public static String hash(ObjectType type, byte[] body) {
        return HexUtils.bytesToHex(sha1(frame(type, body)));
    }

    /**
     * 计算对象的 oid；persist 为 true 时压缩并写入 objects/xx/yyyy...。
     * 同一 oid 的文件已存在时不再写入（内容寻址保证内容相同）。两种模式都返回 oid。
     * 新对象先写到同目录下的临时文件，再整体移动到目标路径，失败时不会留下不完整的对象文件。
     */
    public String write(ObjectType type, byte[] body, boolean persist) throws IOException {
        byte[] content = frame(type, body);
        String oid = HexUtils.bytesToHex(sha1(content));
        if (!persist) {
            log.debug("hashed {} size={} oid={}", type, body.length, oid);
            return oid;
        }

        String relative = objectPath(oid);
        Path objectFile = layout.resolve(relative);
        if (Files.isRegularFile(objectFile)) {
            log.debug("object already stored {} oid={}", type, oid);
            return oid;
        }

        Path dir = layout.ensureDirectories(relative.substring(0, relative.lastIndexOf('/')), true);
        Path temp = Files.createTempFile(dir, TEMP_PREFIX, null);
        try {
            Files.write(temp, deflate(content));
            Files.move(temp, objectFile, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("stored {} size={} oid={}", type, body.length, oid);
        return oid;
    }

    /**
     * 存储对象，返回 40 字符 hex oid。
     */
    public String store(GitObject object) throws IOException {
        return write(object.getType(), object.toBytes(), true);
    }

    /**
     * 读取对象并解压，校验分帧后返回 (type, body)。
     *
     * @throws MissingObjectException                            对象文件不存在
     * @throws CorruptObjectException                            压缩流损坏或缺少类型头
     * @throws com.weixiao.kit.errors.UnknownObjectTypeException 类型名不认识
     * @throws MalformedLengthException                          声明长度与实际不符
     */
    public RawObject load(String oid) throws IOException {
        Path p = layout.resolve(objectPath(oid));
        if (!Files.isRegularFile(p)) {
            throw new MissingObjectException(oid);
        }
        byte[] content = inflate(Files.readAllBytes(p), oid);

        int space = indexOf(content, (byte) ' ', 0);
        if (space < 0) {
            throw new CorruptObjectException("object " + oid + " has no type header");
        }
        ObjectType type = ObjectType.fromName(new String(content, 0, space, StandardCharsets.US_ASCII));

        int nul = indexOf(content, (byte) 0, space + 1);
        if (nul < 0) {
            throw new MalformedLengthException(oid, "no NUL after length");
        }
        String sizeText = new String(content, space + 1, nul - space - 1, StandardCharsets.US_ASCII);
        if (!CANONICAL_LENGTH.matcher(sizeText).matches()) {
            throw new MalformedLengthException(oid, "bad length '" + sizeText + "'");
        }
        int declared;
        try {
            declared = Integer.parseInt(sizeText);
        } catch (NumberFormatException e) {
            throw new MalformedLengthException(oid, "length out of range '" + sizeText + "'");
        }
        int actual = content.length - nul - 1;
        if (declared != actual) {
            throw new MalformedLengthException(oid, "declared " + declared + " bytes, found " + actual);
        }

        byte[] body = new byte[actual];
        System.arraycopy(content, nul + 1, body, 0, actual);
        log.debug("loaded {} size={} oid={}", type, actual, oid);
        return new RawObject(type, body);
    }

    /**
     * 读取对象并按类型解析为 Blob / Tree / Commit。
     *
     * @throws com.weixiao.kit.errors.UnsupportedObjectTypeException 对象是 tag
     */
    public GitObject read(String oid) throws IOException {
        RawObject raw = load(oid);
        return GitObjects.parse(raw.getType(), raw.getBody());
    }

    /**
     * 读取对象，类型不是 expected 时失败。
     */
    public GitObject read(String oid, ObjectType expected) throws IOException {
        GitObject object = read(oid);
        if (object.getType() != expected) {
            throw new UnexpectedObjectTypeException(oid, expected, object.getType());
        }
        return object;
    }

    public Commit readCommit(String oid) throws IOException {
        return (Commit) read(oid, ObjectType.COMMIT);
    }

    public Tree readTree(String oid) throws IOException {
        return (Tree) read(oid, ObjectType.TREE);
    }

    public Blob readBlob(String oid) throws IOException {
        return (Blob) read(oid, ObjectType.BLOB);
    }

    /**
     * 判断给定 oid 的对象文件是否存在。
     */
    public boolean exists(String oid) {
        return Files.isRegularFile(layout.resolve(objectPath(oid)));
    }

    /**
     * 40 字符 hex oid 对应的相对路径 objects/xx/yyyy...（前 2 字符为子目录）。
     */
    static String objectPath(String oid) {
        if (!HexUtils.isObjectId(oid)) {
            throw new InvalidObjectIdException(oid);
        }
        return OBJECTS_DIR + "/" + oid.substring(0, 2) + "/" + oid.substring(2);
    }

    private static byte[] sha1(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-1").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    private static byte[] deflate(byte[] input) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (DeflaterOutputStream def = new DeflaterOutputStream(out)) {
            def.write(input);
        }
        return out.toByteArray();
    }

    /**
     * 完整解压到内存。输入已在内存中，解压过程中的任何 IOException（ZipException、EOFException）都意味着数据损坏。
     */
    private static byte[] inflate(byte[] input, String oid) throws CorruptObjectException {
        try (InflaterInputStream inf = new InflaterInputStream(new ByteArrayInputStream(input));
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            byte[] buf = new byte[8192];
            int n;
            while ((n = inf.read(buf)) != -1) out.write(buf, 0, n);
            return out.toByteArray();
        } catch (IOException e) {
            throw new CorruptObjectException("cannot decompress object " + oid, e);
        }
    }

    private static int indexOf(byte[] a, byte b, int from) {
        for (int i = from; i < a.length; i++) if (a[i] == b) return i;
        return -1;
    }

    /**
     * 从对象库 load 得到的原始对象：类型与解压后的 body 字节。
     */
    @Value
    public static class RawObject {
        ObjectType type;
        byte[] body;
    }
}
