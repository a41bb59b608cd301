package com.optioncalc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OptionCalculatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OptionCalculatorApplication.class, args);
    }
}
