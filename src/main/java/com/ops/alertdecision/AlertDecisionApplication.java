package com.ops.alertdecision;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AlertDecisionApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlertDecisionApplication.class, args);
    }
}
