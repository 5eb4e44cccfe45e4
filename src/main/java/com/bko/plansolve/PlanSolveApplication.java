package com.bko.plansolve;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PlanSolveApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlanSolveApplication.class, args);
    }
}
