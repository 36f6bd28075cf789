package com.grid.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GridAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(GridAnalyticsApplication.class, args);
    }
}
