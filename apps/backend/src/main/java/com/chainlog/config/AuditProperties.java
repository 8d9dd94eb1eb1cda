package com.chainlog.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * HTTP 层的限额配置，对应 application.yml 中的 audit.*
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "audit")
public class AuditProperties {

    private Sessions sessions = new Sessions();
    private Verify verify = new Verify();

    @Data
    public static class Sessions {
        /** 同时保持在内存中的链（engagement + operator）上限 */
        private int maxSessions = 1000;
    }

    @Data
    public static class Verify {
        /** 单次校验请求允许的最大记录数 */
        private int maxRecords = 100_000;
    }
}
