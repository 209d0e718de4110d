package com.chainwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChainWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChainWatchApplication.class, args);
    }
}
