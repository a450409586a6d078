package com.vaultsphere.auth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VaultSphereAuthApplication {

    public static void main(String[] args) {
        SpringApplication.run(VaultSphereAuthApplication.class, args);
    }
}
