package com.manifoldplatform.analysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ManifoldAnalysisApplication {

    public static void main(String[] args) {
        SpringApplication.run(ManifoldAnalysisApplication.class, args);
    }
}
