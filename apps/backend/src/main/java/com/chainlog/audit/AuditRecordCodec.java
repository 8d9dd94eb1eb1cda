package com.chainlog.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * NDJSON 交换格式：一行一条记录。
 * 读出的是原样的 Map（不转成 {@link AuditRecord}），这样多出来或被篡改的字段都会原样进入校验。
 */
@Component
public class AuditRecordCodec {

    private static final TypeReference<Map<String, Object>> RECORD_MAP = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    /** 一行只能有一个对象：行尾多出的内容（第二条记录、垃圾字符）都算格式错误 */
    private final ObjectReader lineReader;

    public AuditRecordCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.lineReader = objectMapper.readerFor(RECORD_MAP)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public String toNdjson(List<AuditRecord> records) {
        StringBuilder sb = new StringBuilder();
        for (AuditRecord r : records) {
            try {
                sb.append(objectMapper.writeValueAsString(r)).append('\n');
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("cannot serialize audit record seq=" + r.sequence(), e);
            }
        }
        return sb.toString();
    }

    public String toNdjsonMaps(List<? extends Map<String, ?>> records) {
        StringBuilder sb = new StringBuilder();
        for (Map<String, ?> r : records) {
            try {
                sb.append(objectMapper.writeValueAsString(r)).append('\n');
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("cannot serialize audit record: " + e.getOriginalMessage(), e);
            }
        }
        return sb.toString();
    }

    /**
     * @throws IllegalArgumentException on the first line that is not a JSON object, naming it (1-based)
     */
    public List<Map<String, Object>> readNdjson(String body) {
        List<Map<String, Object>> out = new ArrayList<>();
        if (body == null) return out;
        String[] lines = body.split("\r?\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) continue;
            Map<String, Object> rec;
            try {
                rec = lineReader.readValue(line);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("malformed NDJSON at line " + (i + 1) + ": " + e.getOriginalMessage(), e);
            }
            if (rec == null) throw new IllegalArgumentException("malformed NDJSON at line " + (i + 1) + ": not an object");
            out.add(rec);
        }
        return out;
    }
}
