package com.edwardjones.personnelsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling // Necessary to enable the scheduled sync job
@ConfigurationPropertiesScan
public class PersonnelSyncApplication {
    public static void main(String[] args) {
        SpringApplication.run(PersonnelSyncApplication.class, args);
    }
}
