package com.chainlog.audit;

import com.chainlog.audit.dto.AuditVerifyReport;
import com.chainlog.audit.dto.LogEventRequest;
import com.chainlog.config.AuditProperties;
import com.chainlog.util.CanonicalEncodingException;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/audit")
@RequiredArgsConstructor
public class AuditController {

    static final String NDJSON = "application/x-ndjson";

    private final AuditSessionRegistry sessions;
    private final AuditVerifyService verifyService;
    private final AuditRecordCodec codec;
    private final AuditProperties properties;

    @Operation(summary = "追加审计事件（首次写入时自动打开会话），返回带 chain_hash 的记录")
    @PostMapping(value = "/sessions/{engagementId}/{operatorId}/events",
            consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<AuditRecord> logEvent(@PathVariable String engagementId,
                                      @PathVariable String operatorId,
                                      @Valid @RequestBody LogEventRequest req) {
        return Mono.fromCallable(() -> sessions.log(engagementId, operatorId,
                        req.action(), req.result(), req.authorization(), req.taskId()))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(CanonicalEncodingException.class,
                        e -> new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e))
                .onErrorMap(AuditSessionRegistry.SessionLimitExceededException.class,
                        e -> new ResponseStatusException(HttpStatus.TOO_MANY_REQUESTS, e.getMessage(), e));
    }

    @Operation(summary = "获取会话当前链尾（tailHash）与序号")
    @GetMapping(value = "/sessions/{engagementId}/{operatorId}/tail", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> tail(@PathVariable String engagementId, @PathVariable String operatorId) {
        return Mono.fromCallable(() -> sessions.tail(engagementId, operatorId)
                .map(t -> {
                    Map<String, Object> m = new LinkedHashMap<>();
                    m.put("engagementId", t.engagementId());
                    m.put("operatorId", t.operatorId());
                    m.put("sequence", t.sequence());
                    m.put("tailHash", t.tailHash());
                    return m;
                })
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "no open audit session for " + engagementId + "/" + operatorId)));
    }

    @Operation(summary = "关闭会话，丢弃内存中的链尾")
    @DeleteMapping(value = "/sessions/{engagementId}/{operatorId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> close(@PathVariable String engagementId, @PathVariable String operatorId) {
        return Mono.fromCallable(() -> Map.<String, Object>of("closed", sessions.close(engagementId, operatorId)));
    }

    @Operation(summary = "校验 JSON 数组形式的记录链，返回报告")
    @PostMapping(value = "/verify", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<AuditVerifyReport> verify(@RequestBody List<Map<String, Object>> records,
                                          @RequestParam(required = false) String expectedTail) {
        return verifyAsync(records, expectedTail);
    }

    @Operation(summary = "校验 NDJSON（一行一条记录）形式的记录链，返回报告")
    @PostMapping(value = "/verify/ndjson", consumes = NDJSON, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<AuditVerifyReport> verifyNdjson(@RequestBody String body,
                                                @RequestParam(required = false) String expectedTail) {
        return Mono.fromCallable(() -> codec.readNdjson(body))
                .onErrorMap(IllegalArgumentException.class,
                        e -> new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e))
                .flatMap(records -> verifyAsync(records, expectedTail));
    }

    @Operation(summary = "把 JSON 数组形式的记录转成 NDJSON 下载")
    @PostMapping(value = "/export/ndjson", consumes = MediaType.APPLICATION_JSON_VALUE, produces = NDJSON)
    public Mono<ResponseEntity<String>> exportNdjson(@RequestBody List<Map<String, Object>> records) {
        return Mono.fromCallable(() -> ResponseEntity.ok()
                        .contentType(MediaType.parseMediaType(NDJSON + "; charset=UTF-8"))
                        .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                                .filename("audit.ndjson", StandardCharsets.UTF_8).build().toString())
                        .body(codec.toNdjsonMaps(records)))
                .onErrorMap(IllegalArgumentException.class,
                        e -> new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e));
    }

    /** 请求体超过 spring.codec.max-in-memory-size，在进入方法前就被解码器拒绝 */
    @ExceptionHandler(DataBufferLimitException.class)
    public ResponseEntity<Map<String, Object>> onBodyTooLarge(DataBufferLimitException e) {
        log.warn("[AUDIT-HTTP] request body too large: {}", e.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", HttpStatus.PAYLOAD_TOO_LARGE.value());
        body.put("error", HttpStatus.PAYLOAD_TOO_LARGE.getReasonPhrase());
        body.put("message", e.getMessage());
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(body);
    }

    private Mono<AuditVerifyReport> verifyAsync(List<Map<String, Object>> records, String expectedTail) {
        int limit = properties.getVerify().getMaxRecords();
        if (records.size() > limit) {
            return Mono.error(new ResponseStatusException(HttpStatus.PAYLOAD_TOO_LARGE,
                    "too many records: " + records.size() + " > " + limit));
        }
        return Mono.fromCallable(() -> verifyService.verify(records, expectedTail))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(CanonicalEncodingException.class,
                        e -> new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e));
    }
}
