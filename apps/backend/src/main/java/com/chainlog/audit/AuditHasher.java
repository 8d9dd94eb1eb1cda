package com.chainlog.audit;

import com.chainlog.util.Fingerprint;
import com.chainlog.util.JsonCanonicalizer;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 写入端与校验端共用的哈希规则。两边都走 {@link JsonCanonicalizer}，
 * 记录写入时算出的哈希事后可原样复算。
 */
public final class AuditHasher {
    private AuditHasher() {}

    public static final String CURRENT_SCHEMA_VERSION = "1.0";

    /** 首条记录的 prev_chain_hash：64 个 '0' */
    public static final String GENESIS_HASH = "0".repeat(64);

    /** result_hash 只取 SHA-256 前 16 位十六进制（64 bit），为兼容已有日志保留；抗碰撞强度有限 */
    public static final int RESULT_HASH_LENGTH = 16;

    public static String sha256Hex(Object value) {
        return Fingerprint.sha256(JsonCanonicalizer.canonicalBytes(value));
    }

    /** result_hash：对 {"result": result} 规范化后取 SHA-256 前 16 位 */
    public static String resultHash(Object result) {
        // 包一层，区分顶层标量/数组与对象型负载；Map.of 不接受 null
        Map<String, Object> wrapped = new HashMap<>();
        wrapped.put("result", result);
        return sha256Hex(wrapped).substring(0, RESULT_HASH_LENGTH);
    }

    /** chain_hash：对记录中除 chain_hash 外的所有字段做完整 SHA-256 */
    public static String chainHash(Map<String, ?> record) {
        return sha256Hex(withoutChainHash(record));
    }

    public static Map<String, Object> withoutChainHash(Map<String, ?> record) {
        Map<String, Object> copy = new LinkedHashMap<>(record);
        copy.remove(AuditRecord.CHAIN_HASH);
        return copy;
    }
}
