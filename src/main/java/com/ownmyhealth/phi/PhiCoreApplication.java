package com.ownmyhealth.phi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PhiCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(PhiCoreApplication.class, (String[])args);
    }
}
