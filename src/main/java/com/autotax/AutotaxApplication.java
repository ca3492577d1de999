package com.autotax;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AutotaxApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutotaxApplication.class, args);
    }
}
