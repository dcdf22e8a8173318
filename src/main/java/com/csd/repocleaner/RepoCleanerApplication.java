package com.csd.repocleaner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RepoCleanerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RepoCleanerApplication.class, args);
    }
}
