package com.chainlog;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@Slf4j
public class ChainlogApplication {

    public static void main(String[] args) {
        log.info("Starting chainlog audit service");
        SpringApplication.run(ChainlogApplication.class, args);
        log.info("chainlog audit service started");
    }

}
