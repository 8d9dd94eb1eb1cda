package com.chainlog.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 审计链上的一环，字段与线上格式一一对应。
 * {@code task_id} 总是输出，事件没有任务时为 {@code null}。
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({
        AuditRecord.SCHEMA_VERSION, AuditRecord.ENGAGEMENT_ID, AuditRecord.OPERATOR_ID,
        AuditRecord.SEQUENCE, AuditRecord.TIMESTAMP, AuditRecord.ACTION, AuditRecord.TASK_ID,
        AuditRecord.AUTHORIZATION, AuditRecord.RESULT_HASH, AuditRecord.PREV_CHAIN_HASH,
        AuditRecord.CHAIN_HASH
})
public record AuditRecord(
        @JsonProperty(AuditRecord.SCHEMA_VERSION) String schemaVersion,
        @JsonProperty(AuditRecord.ENGAGEMENT_ID) String engagementId,
        @JsonProperty(AuditRecord.OPERATOR_ID) String operatorId,
        @JsonProperty(AuditRecord.SEQUENCE) long sequence,
        @JsonProperty(AuditRecord.TIMESTAMP) String timestamp,
        @JsonProperty(AuditRecord.ACTION) String action,
        @JsonProperty(AuditRecord.TASK_ID) String taskId,
        @JsonProperty(AuditRecord.AUTHORIZATION) String authorization,
        @JsonProperty(AuditRecord.RESULT_HASH) String resultHash,
        @JsonProperty(AuditRecord.PREV_CHAIN_HASH) String prevChainHash,
        @JsonProperty(AuditRecord.CHAIN_HASH) String chainHash
) {
    public static final String SCHEMA_VERSION = "schema_version";
    public static final String ENGAGEMENT_ID = "engagement_id";
    public static final String OPERATOR_ID = "operator_id";
    public static final String SEQUENCE = "sequence";
    public static final String TIMESTAMP = "timestamp";
    public static final String ACTION = "action";
    public static final String TASK_ID = "task_id";
    public static final String AUTHORIZATION = "authorization";
    public static final String RESULT_HASH = "result_hash";
    public static final String PREV_CHAIN_HASH = "prev_chain_hash";
    public static final String CHAIN_HASH = "chain_hash";

    /** 可变副本（按线上字段顺序），供序列化、校验与篡改测试使用 */
    public Map<String, Object> toMap() {
        Map<String, Object> m = unsignedFields();
        m.put(CHAIN_HASH, chainHash);
        return m;
    }

    /** 除 chain_hash 以外的全部字段：即 chain_hash 的哈希输入 */
    Map<String, Object> unsignedFields() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(SCHEMA_VERSION, schemaVersion);
        m.put(ENGAGEMENT_ID, engagementId);
        m.put(OPERATOR_ID, operatorId);
        m.put(SEQUENCE, sequence);
        m.put(TIMESTAMP, timestamp);
        m.put(ACTION, action);
        m.put(TASK_ID, taskId);
        m.put(AUTHORIZATION, authorization);
        m.put(RESULT_HASH, resultHash);
        m.put(PREV_CHAIN_HASH, prevChainHash);
        return m;
    }

    AuditRecord withChainHash(String hash) {
        return new AuditRecord(schemaVersion, engagementId, operatorId, sequence, timestamp,
                action, taskId, authorization, resultHash, prevChainHash, hash);
    }

    public static List<Map<String, Object>> toMaps(List<AuditRecord> records) {
        List<Map<String, Object>> out = new ArrayList<>(records.size());
        for (AuditRecord r : records) out.add(r == null ? null : r.toMap());
        return out;
    }
}
