package com.chainlog.audit;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * 向一条哈希链追加事件。每个 engagement/operator 会话一个实例，只持有链尾与序号，不做存储和 I/O。
 *
 * 非线程安全：{@link #logEvent} 把读链尾、推进序号当作一个整体，
 * 并发调用方需自行串行化（见 {@link AuditSessionRegistry}）。
 */
@Slf4j
public class AuditChainLogger {

    static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    @Getter
    private final String engagementId;
    @Getter
    private final String operatorId;
    private final Clock clock;

    @Getter
    private String chainTip = AuditHasher.GENESIS_HASH;
    @Getter
    private long sequence = 0;

    public AuditChainLogger(String engagementId, String operatorId) {
        this(engagementId, operatorId, Clock.systemUTC());
    }

    public AuditChainLogger(String engagementId, String operatorId, Clock clock) {
        this.engagementId = Objects.requireNonNull(engagementId, "engagementId");
        this.operatorId = Objects.requireNonNull(operatorId, "operatorId");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public AuditRecord logEvent(String action, Object result, String authorization) {
        return logEvent(action, result, authorization, null);
    }

    /**
     * Records one event and advances the chain.
     *
     * @param result hashed into {@code result_hash}, never stored
     * @throws com.chainlog.util.CanonicalEncodingException if {@code result} cannot be encoded;
     *         the chain state is left untouched in that case
     */
    public AuditRecord logEvent(String action, Object result, String authorization, String taskId) {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(authorization, "authorization");

        // 先算 result_hash：编码失败时不消耗序号
        String resultHash = AuditHasher.resultHash(result);

        long seq = sequence + 1;
        String timestamp = TIMESTAMP_FORMAT.format(clock.instant());

        AuditRecord unsigned = new AuditRecord(
                AuditHasher.CURRENT_SCHEMA_VERSION, engagementId, operatorId, seq, timestamp,
                action, taskId, authorization, resultHash, chainTip, null);
        String chainHash = AuditHasher.sha256Hex(unsigned.unsignedFields());

        sequence = seq;
        chainTip = chainHash;
        log.debug("[AUDIT-LOG] engagement={} operator={} seq={} action={} hash={}",
                engagementId, operatorId, seq, action, chainHash);
        return unsigned.withChainHash(chainHash);
    }
}
