package com.example.threadcache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ThreadCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(ThreadCacheApplication.class, args);
    }
}
