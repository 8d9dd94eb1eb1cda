package com.chainlog.audit;

import com.chainlog.audit.dto.AuditIssue;
import com.chainlog.audit.dto.AuditVerifyReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.chainlog.audit.AuditRecord.CHAIN_HASH;
import static com.chainlog.audit.AuditRecord.PREV_CHAIN_HASH;
import static com.chainlog.audit.AuditRecord.SEQUENCE;

/**
 * 按输入顺序逐条校验：
 *   - chain_hash / prev_chain_hash 是否存在
 *   - prev_chain_hash 是否等于上一条的 chain_hash（首条为创世值）
 *   - chain_hash 是否等于去掉 chain_hash 后其余字段（原样，含未知字段）的规范化 SHA-256
 * 在第一个断点处停止并报告位置。
 *
 * 纯函数：不依赖任何 logger 的运行时状态，可并发调用。
 * 链断裂是预期结果（返回 false / 报告），只有无法规范化的记录才抛出
 * {@link com.chainlog.util.CanonicalEncodingException}。
 */
@Slf4j
@Service
public class AuditVerifyService {

    public AuditVerifyReport verify(List<? extends Map<String, ?>> records) {
        return verify(records, null);
    }

    /**
     * @param expectedTail 外部锚定的尾哈希（如之前从 /tail 取得并另行保存的值），可为 null
     */
    public AuditVerifyReport verify(List<? extends Map<String, ?>> records, String expectedTail) {
        AuditVerifyReport rep = inspect(records, expectedTail);
        if (rep.ok()) {
            log.info("[AUDIT-VERIFY] ok total={} tail={}", rep.total(), rep.tailHash());
        } else {
            log.warn("[AUDIT-VERIFY] broken index={} reason={} verified={}/{}",
                    rep.firstBadIndex(), rep.issue().reason(), rep.verified(), rep.total());
        }
        return rep;
    }

    public static boolean verifyChain(List<? extends Map<String, ?>> records) {
        return inspect(records, null).ok();
    }

    public static boolean verifyRecords(List<AuditRecord> records) {
        return verifyChain(AuditRecord.toMaps(records));
    }

    public static AuditVerifyReport inspect(List<? extends Map<String, ?>> records) {
        return inspect(records, null);
    }

    public static AuditVerifyReport inspect(List<? extends Map<String, ?>> records, String expectedTail) {
        Objects.requireNonNull(records, "records");
        int total = records.size();
        String expectPrev = AuditHasher.GENESIS_HASH;

        for (int i = 0; i < total; i++) {
            Map<String, ?> r = records.get(i);

            if (r == null || !r.containsKey(CHAIN_HASH) || !r.containsKey(PREV_CHAIN_HASH)) {
                var issue = new AuditIssue(i, r == null ? null : r.get(SEQUENCE),
                        AuditIssue.Reason.MISSING_LINK_FIELDS, null, null);
                return AuditVerifyReport.broken(total, i, issue, expectPrev);
            }

            Object storedPrev = r.get(PREV_CHAIN_HASH);
            if (!expectPrev.equals(storedPrev)) {
                var issue = new AuditIssue(i, r.get(SEQUENCE),
                        AuditIssue.Reason.PREV_HASH_MISMATCH, expectPrev, asStr(storedPrev));
                return AuditVerifyReport.broken(total, i, issue, expectPrev);
            }

            String expectHash = AuditHasher.chainHash(r);
            Object storedHash = r.get(CHAIN_HASH);
            if (!expectHash.equals(storedHash)) {
                var issue = new AuditIssue(i, r.get(SEQUENCE),
                        AuditIssue.Reason.CHAIN_HASH_MISMATCH, expectHash, asStr(storedHash));
                return AuditVerifyReport.broken(total, i, issue, expectPrev);
            }

            expectPrev = expectHash;
        }

        if (expectedTail != null && !expectedTail.equals(expectPrev)) {
            var issue = new AuditIssue(total, null, AuditIssue.Reason.TAIL_MISMATCH, expectedTail, expectPrev);
            return AuditVerifyReport.broken(total, total, issue, expectPrev);
        }
        return AuditVerifyReport.valid(total, expectPrev);
    }

    private static String asStr(Object v) {
        return (v == null) ? null : String.valueOf(v);
    }
}
