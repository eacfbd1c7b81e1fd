package com.awsmap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AwsMapApplication {

    public static void main(String[] args) {
        SpringApplication.run(AwsMapApplication.class, args);
    }
}
