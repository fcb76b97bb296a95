package com.coparent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CoparentApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoparentApplication.class, args);
    }
}
