package com.cityexplorer.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CityExplorerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CityExplorerApplication.class, args);
    }
}
