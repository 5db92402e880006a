package com.teambind.snowflake;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SnowflakeApplication {

    public static void main(String[] args) {
        SpringApplication.run(SnowflakeApplication.class, args);
    }
}
