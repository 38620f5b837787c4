package com.opro;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class OproApplication {

    public static void main(String[] args) {
        SpringApplication.run(OproApplication.class, args);
    }
}
