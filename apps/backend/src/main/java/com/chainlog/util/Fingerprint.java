package com.chainlog.util;

import org.apache.commons.codec.digest.DigestUtils;

import java.nio.charset.StandardCharsets;

public final class Fingerprint {
    private Fingerprint(){}

    /** 小写十六进制 SHA-256 */
    public static String sha256(byte[] data) {
        return DigestUtils.sha256Hex(data);
    }

    public static String sha256(String s) {
        return sha256(s.getBytes(StandardCharsets.UTF_8));
    }
}
