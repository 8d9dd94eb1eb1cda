package com.chainlog.audit;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@AutoConfigureWebTestClient
class AuditControllerTest {

    private static final ParameterizedTypeReference<Map<String, Object>> MAP = new ParameterizedTypeReference<>() {};

    @Autowired
    private WebTestClient client;

    @Autowired
    private AuditRecordCodec codec;

    private Map<String, Object> post(String operator, Map<String, Object> body) {
        return client.post().uri("/audit/sessions/eng-001/{op}/events", operator)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isOk()
                .expectBody(MAP)
                .returnResult().getResponseBody();
    }

    private List<Map<String, Object>> logTwo(String operator) {
        Map<String, Object> first = new HashMap<>();
        first.put("action", "scan");
        first.put("result", Map.of("hosts", 5, "open_ports", List.of(22, 443)));
        first.put("authorization", "approval-001");
        Map<String, Object> second = new HashMap<>(first);
        second.put("action", "report");
        second.put("task_id", "task-7");

        List<Map<String, Object>> records = new ArrayList<>();
        records.add(post(operator, first));
        records.add(post(operator, second));
        return records;
    }

    @Test
    void eventsAreChainedPerSession() {
        List<Map<String, Object>> records = logTwo("op-chain");

        assertEquals(1, ((Number) records.get(0).get("sequence")).intValue());
        assertEquals(2, ((Number) records.get(1).get("sequence")).intValue());
        assertEquals(records.get(0).get("chain_hash"), records.get(1).get("prev_chain_hash"));
        assertTrue(records.get(0).containsKey("task_id"));
        assertNull(records.get(0).get("task_id"));
        assertEquals("task-7", records.get(1).get("task_id"));
        assertEquals("add599a2b0be4218", records.get(0).get("result_hash"));
        assertThat(records.get(0)).doesNotContainKey("result");
    }

    @Test
    void unencodableResultIsRejected() {
        // 1e400 解析为 Infinity，规范化编码不接受
        client.post().uri("/audit/sessions/eng-001/op-infinity/events")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"action\":\"scan\",\"authorization\":\"approval-001\",\"result\":1e400}")
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void verifiesChainsLargerThanTheDefaultCodecBuffer() {
        AuditChainLogger logger = new AuditChainLogger("eng-001", "op-bulk");
        List<AuditRecord> records = new ArrayList<>();
        for (int i = 0; i < 2000; i++) {
            records.add(logger.logEvent("scan-" + i, Map.of("host", "10.0.0." + (i % 255)), "approval-001"));
        }

        client.post().uri("/audit/verify")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(AuditRecord.toMaps(records))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.ok").isEqualTo(true)
                .jsonPath("$.total").isEqualTo(2000)
                .jsonPath("$.tailHash").isEqualTo(logger.getChainTip());
    }

    @Test
    void missingActionIsRejected() {
        client.post().uri("/audit/sessions/eng-001/op-invalid/events")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("authorization", "approval-001"))
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void tailFollowsTheLastRecordAndUnknownSessionIs404() {
        List<Map<String, Object>> records = logTwo("op-tail");

        client.get().uri("/audit/sessions/eng-001/op-tail/tail")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.sequence").isEqualTo(2)
                .jsonPath("$.tailHash").isEqualTo(records.get(1).get("chain_hash"));

        client.get().uri("/audit/sessions/eng-001/op-nobody/tail")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void closeDropsTheSession() {
        logTwo("op-close");
        client.delete().uri("/audit/sessions/eng-001/op-close")
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.closed").isEqualTo(true);
        client.get().uri("/audit/sessions/eng-001/op-close/tail")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void verifyReportsIntactAndTamperedChains() {
        List<Map<String, Object>> records = logTwo("op-verify");

        client.post().uri("/audit/verify")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(records)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.ok").isEqualTo(true)
                .jsonPath("$.total").isEqualTo(2)
                .jsonPath("$.tailHash").isEqualTo(records.get(1).get("chain_hash"));

        records.get(1).put("action", "tampered");
        client.post().uri("/audit/verify")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(records)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.ok").isEqualTo(false)
                .jsonPath("$.firstBadIndex").isEqualTo(1)
                .jsonPath("$.issue.reason").isEqualTo("CHAIN_HASH_MISMATCH");
    }

    @Test
    void verifyWithAnchorDetectsTruncation() {
        List<Map<String, Object>> records = logTwo("op-anchor");
        String tail = (String) records.get(1).get("chain_hash");

        client.post().uri(b -> b.path("/audit/verify").queryParam("expectedTail", tail).build())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(List.of(records.get(0)))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.ok").isEqualTo(false)
                .jsonPath("$.issue.reason").isEqualTo("TAIL_MISMATCH");
    }

    @Test
    void ndjsonVerificationAndExport() {
        List<Map<String, Object>> records = logTwo("op-ndjson");

        String exported = client.post().uri("/audit/export/ndjson")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(records)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueMatches("Content-Disposition", ".*audit\\.ndjson.*")
                .expectBody(String.class)
                .returnResult().getResponseBody();
        assertNotNull(exported);
        assertEquals(2, exported.lines().count());
        assertEquals(exported, codec.toNdjsonMaps(records));

        client.post().uri("/audit/verify/ndjson")
                .contentType(MediaType.parseMediaType(AuditController.NDJSON))
                .bodyValue(exported)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.ok").isEqualTo(true)
                .jsonPath("$.verified").isEqualTo(2);

        client.post().uri("/audit/verify/ndjson")
                .contentType(MediaType.parseMediaType(AuditController.NDJSON))
                .bodyValue(exported.lines().findFirst().orElseThrow() + "\n{oops\n")
                .exchange()
                .expectStatus().isBadRequest();
    }
}
