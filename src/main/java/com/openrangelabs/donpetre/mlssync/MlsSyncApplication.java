package com.openrangelabs.donpetre.mlssync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MlsSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(MlsSyncApplication.class, args);
    }

}
