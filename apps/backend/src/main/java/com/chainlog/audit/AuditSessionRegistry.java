package com.chainlog.audit;

import com.chainlog.config.AuditProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 每个 (engagementId, operatorId) 一条内存中的链。
 * {@link AuditChainLogger} 自身不加锁，这里在 logger 实例上串行化同一会话的并发写入。
 * 只保存链尾与序号，记录本身交还调用方持久化。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuditSessionRegistry {

    public static record Key(String engagementId, String operatorId) {}

    public record Tail(String engagementId, String operatorId, long sequence, String tailHash) {}

    public static class SessionLimitExceededException extends RuntimeException {
        public SessionLimitExceededException(int limit) {
            super("too many open audit sessions (limit " + limit + ")");
        }
    }

    private final AuditProperties properties;
    private final Clock clock;

    private final ConcurrentMap<Key, AuditChainLogger> sessions = new ConcurrentHashMap<>();

    public AuditRecord log(String engagementId, String operatorId,
                           String action, Object result, String authorization, String taskId) {
        AuditChainLogger logger = open(engagementId, operatorId);
        synchronized (logger) {
            return logger.logEvent(action, result, authorization, taskId);
        }
    }

    public AuditChainLogger open(String engagementId, String operatorId) {
        Key key = new Key(engagementId, operatorId);
        AuditChainLogger existing = sessions.get(key);
        if (existing != null) return existing;

        return sessions.computeIfAbsent(key, k -> {
            int limit = properties.getSessions().getMaxSessions();
            if (sessions.size() >= limit) throw new SessionLimitExceededException(limit);
            log.info("[AUDIT-SESSION] open engagement={} operator={}", engagementId, operatorId);
            return new AuditChainLogger(engagementId, operatorId, clock);
        });
    }

    public Optional<Tail> tail(String engagementId, String operatorId) {
        AuditChainLogger logger = sessions.get(new Key(engagementId, operatorId));
        if (logger == null) return Optional.empty();
        synchronized (logger) {
            return Optional.of(new Tail(engagementId, operatorId, logger.getSequence(), logger.getChainTip()));
        }
    }

    /** 丢弃内存中的链尾；之后同一会话再写入会从创世值重新开始一条新链 */
    public boolean close(String engagementId, String operatorId) {
        AuditChainLogger removed = sessions.remove(new Key(engagementId, operatorId));
        if (removed != null) {
            log.info("[AUDIT-SESSION] close engagement={} operator={} seq={}",
                    engagementId, operatorId, removed.getSequence());
        }
        return removed != null;
    }

    public int size() {
        return sessions.size();
    }
}
