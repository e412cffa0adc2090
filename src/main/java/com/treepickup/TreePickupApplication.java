package com.treepickup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Tree pickup team planner
 * Splits geocoded pickup locations into balanced volunteer teams over HTTP
 */
@SpringBootApplication
public class TreePickupApplication {
    public static void main(String[] args) {
        SpringApplication.run(TreePickupApplication.class, args);
    }
}
