package com.work.txqueue;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot 启动入口，运行后即可通过 REST 接口入队并跟踪交易。
 */
@SpringBootApplication
@EnableScheduling
public class TxQueueApplication {

    public static void main(String[] args) {
        SpringApplication.run(TxQueueApplication.class, args);
    }
}
