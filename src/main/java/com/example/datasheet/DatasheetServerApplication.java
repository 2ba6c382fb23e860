package com.example.datasheet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DatasheetServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DatasheetServerApplication.class, args);
    }

}
