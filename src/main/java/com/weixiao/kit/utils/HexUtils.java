package com.weixiao.kit.utils;

import com.weixiao.kit.errors.InvalidObjectIdException;
import lombok.experimental.UtilityClass;

import java.util.regex.Pattern;

/**
 * 十六进制与字节互转工具，用于 oid（40 字符 hex）与 tree 条目中的 20 字节二进制 id。
 */
@UtilityClass
public class HexUtils {

    /** oid 的二进制长度（SHA-1 摘要）。 */
    public static final int OID_RAW_LENGTH = 20;

    /** oid 的十六进制长度。 */
    public static final int OID_HEX_LENGTH = 40;

    private static final Pattern OID = Pattern.compile("[0-9a-f]{40}");

    private static final char[] DIGITS = "0123456789abcdef".toCharArray();

    /**
     * 判断字符串是否为合法 oid：恰好 40 个小写十六进制字符。
     */
    public static boolean isObjectId(String s) {
        return s != null && OID.matcher(s).matches();
    }

    /**
     * 将 40 字符十六进制 oid 转为 20 字节。
     * 例："ce01" + 36 个 hex → 20 字节。
     *
     * @param hex 40 字符 0-9a-f 字符串
     * @return 20 字节
     * @throws InvalidObjectIdException hex 长度不是 40 或含非十六进制字符
     */
    public static byte[] hexToBytes(String hex) {
        if (hex == null || hex.length() != OID_HEX_LENGTH) {
            throw new InvalidObjectIdException(hex);
        }
        byte[] b = new byte[OID_RAW_LENGTH];
        for (int i = 0; i < OID_RAW_LENGTH; i++) {
            int hi = Character.digit(hex.charAt(i * 2), 16);
            int lo = Character.digit(hex.charAt(i * 2 + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new InvalidObjectIdException(hex);
            }
            b[i] = (byte) ((hi << 4) | lo);
        }
        return b;
    }

    /**
     * 将字节数组转为小写十六进制字符串（如 SHA-1 的 40 字符 oid）。
     *
     * @param bytes 任意长度
     * @return 小写 hex 字符串
     */
    public static String bytesToHex(byte[] bytes) {
        if (bytes == null) return "";
        return bytesToHex(bytes, 0, bytes.length);
    }

    /**
     * 将 bytes[offset, offset + length) 转为小写十六进制字符串，供 tree 解析时直接读取内嵌的 20 字节 id。
     */
    public static String bytesToHex(byte[] bytes, int offset, int length) {
        StringBuilder sb = new StringBuilder(length * 2);
        for (int i = offset; i < offset + length; i++) {
            sb.append(DIGITS[(bytes[i] >> 4) & 0xf]).append(DIGITS[bytes[i] & 0xf]);
        }
        return sb.toString();
    }
}
