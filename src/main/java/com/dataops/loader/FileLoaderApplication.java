package com.dataops.loader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FileLoaderApplication {

    public static void main(String[] args) {
        SpringApplication.run(FileLoaderApplication.class, args);
    }
}
