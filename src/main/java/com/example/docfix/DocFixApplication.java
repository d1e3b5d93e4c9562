package com.example.docfix;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@Slf4j
@EnableScheduling
@SpringBootApplication
public class DocFixApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocFixApplication.class, args);
        log.info("DocFix started");
    }
}
