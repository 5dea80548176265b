package com.autotrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AutotraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutotraderApplication.class, args);
    }
}
