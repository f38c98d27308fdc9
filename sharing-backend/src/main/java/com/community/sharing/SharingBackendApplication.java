package com.community.sharing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SharingBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(SharingBackendApplication.class, args);
    }

}
