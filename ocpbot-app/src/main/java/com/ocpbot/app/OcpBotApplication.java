package com.ocpbot.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * OCP sustaining bot entry point.
 */
@SpringBootApplication
@ComponentScan(basePackages = "com.ocpbot")
public class OcpBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(OcpBotApplication.class, args);
    }
}
