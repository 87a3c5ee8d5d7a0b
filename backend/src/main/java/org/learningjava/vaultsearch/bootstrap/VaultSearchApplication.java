package org.learningjava.vaultsearch.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "org.learningjava.vaultsearch")
public class VaultSearchApplication {
    public static void main(String[] args) {
        SpringApplication.run(VaultSearchApplication.class, args);
    }
}
