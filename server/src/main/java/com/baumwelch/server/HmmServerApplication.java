package com.baumwelch.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HmmServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(HmmServerApplication.class, args);
    }
}
