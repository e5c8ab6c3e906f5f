package com.tsingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TsIngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(TsIngestApplication.class, args);
    }
}
