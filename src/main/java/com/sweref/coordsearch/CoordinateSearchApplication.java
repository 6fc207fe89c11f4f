package com.sweref.coordsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CoordinateSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoordinateSearchApplication.class, args);
    }
}
