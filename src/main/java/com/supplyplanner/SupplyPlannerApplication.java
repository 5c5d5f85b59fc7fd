package com.supplyplanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SupplyPlannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SupplyPlannerApplication.class, args);
    }
}
