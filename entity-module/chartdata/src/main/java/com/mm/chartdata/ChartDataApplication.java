package com.mm.chartdata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChartDataApplication {
    public static void main(String[] args) {
        SpringApplication.run(ChartDataApplication.class, args);
    }
}
