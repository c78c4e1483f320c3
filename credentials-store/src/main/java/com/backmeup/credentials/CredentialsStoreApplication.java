package com.backmeup.credentials;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CredentialsStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(CredentialsStoreApplication.class, args);
    }
}
