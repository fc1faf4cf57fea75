package com.williamcallahan.keycoordinator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class KeyCoordinatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(KeyCoordinatorApplication.class, args);
    }

}
