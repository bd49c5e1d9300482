package com.foo.sheets;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SheetSummaryApplication {

    public static void main(String[] args) {
        SpringApplication.run(SheetSummaryApplication.class, args);
    }
}
