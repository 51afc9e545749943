package com.agentdaemon.daemon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DaemonServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(DaemonServiceApplication.class, args);
    }
}
