package com.chmonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChMonitorApplication.class, args);
    }
}
