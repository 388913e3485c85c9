package com.topdeck.riskgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TopDeckRiskGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(TopDeckRiskGraphApplication.class, args);
    }
}
