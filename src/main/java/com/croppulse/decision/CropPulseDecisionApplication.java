package com.croppulse.decision;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CropPulseDecisionApplication {

    public static void main(String[] args) {
        SpringApplication.run(CropPulseDecisionApplication.class, args);
    }
}
