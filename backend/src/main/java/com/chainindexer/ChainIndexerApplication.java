package com.chainindexer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChainIndexerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChainIndexerApplication.class, args);
    }
}
