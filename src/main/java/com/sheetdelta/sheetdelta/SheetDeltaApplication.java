package com.sheetdelta.sheetdelta;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SheetDeltaApplication {

    public static void main(String[] args) {
        SpringApplication.run(SheetDeltaApplication.class, args);
    }
}
