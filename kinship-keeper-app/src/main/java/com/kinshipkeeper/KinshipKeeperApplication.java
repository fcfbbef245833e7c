package com.kinshipkeeper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KinshipKeeperApplication {

    public static void main(String[] args) {
        SpringApplication.run(KinshipKeeperApplication.class, args);
    }
}
