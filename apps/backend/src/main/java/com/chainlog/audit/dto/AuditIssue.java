package com.chainlog.audit.dto;

/**
 * 链上第一个校验不通过的位置。
 */
public record AuditIssue(
        int index,          // 在输入序列中的位置（从 0 起）
        Object sequence,    // 该记录自带的 sequence（可能缺失或被篡改）
        Reason reason,
        String expected,
        String actual
) {
    public enum Reason {
        /** chain_hash 或 prev_chain_hash 缺失，或记录本身为 null */
        MISSING_LINK_FIELDS,
        /** prev_chain_hash 与前一条的 chain_hash 不一致：删除、插入或乱序 */
        PREV_HASH_MISMATCH,
        /** 重算的 chain_hash 与存储值不一致：字段被改动 */
        CHAIN_HASH_MISMATCH,
        /** 链本身完好，但末尾与外部锚定的尾哈希不一致：尾部被截断或追加 */
        TAIL_MISMATCH
    }
}
