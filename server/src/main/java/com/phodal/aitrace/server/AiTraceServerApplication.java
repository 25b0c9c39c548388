package com.phodal.aitrace.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AiTraceServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AiTraceServerApplication.class, args);
    }
}
