package com.chicu.airetrain;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.chicu.airetrain")
public class AiRetrainApplication {

    public static void main(String[] args) {
        SpringApplication.run(AiRetrainApplication.class, args);
    }
}
