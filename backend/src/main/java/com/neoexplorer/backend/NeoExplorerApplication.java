package com.neoexplorer.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NeoExplorerApplication {

    public static void main(String[] args) {
        SpringApplication.run(NeoExplorerApplication.class, args);
    }
}
