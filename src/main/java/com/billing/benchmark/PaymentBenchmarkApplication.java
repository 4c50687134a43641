package com.billing.benchmark;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PaymentBenchmarkApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaymentBenchmarkApplication.class, args);
    }
}
