package com.enterprise.sheetrecovery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SheetRecoveryApplication {

    public static void main(String[] args) {
        SpringApplication.run(SheetRecoveryApplication.class, args);
    }
}
