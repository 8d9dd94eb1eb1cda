package com.chainlog.audit.dto;

public record AuditVerifyReport(
        boolean ok,
        int total,              // 被校验的条目数
        int verified,           // 断点之前通过的条目数
        Integer firstBadIndex,  // 完好时为 null
        AuditIssue issue,
        String tailHash         // 最后一条通过校验的 chain_hash；空链为创世值
) {
    public static AuditVerifyReport valid(int total, String tailHash) {
        return new AuditVerifyReport(true, total, total, null, null, tailHash);
    }

    public static AuditVerifyReport broken(int total, int verified, AuditIssue issue, String tailHash) {
        return new AuditVerifyReport(false, total, verified, issue.index(), issue, tailHash);
    }
}
