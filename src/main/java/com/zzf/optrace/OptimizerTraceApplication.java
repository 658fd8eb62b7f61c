package com.zzf.optrace;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OptimizerTraceApplication {

    public static void main(String[] args) {
        SpringApplication.run(OptimizerTraceApplication.class, args);
    }
}
