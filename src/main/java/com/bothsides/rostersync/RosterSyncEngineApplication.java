package com.bothsides.rostersync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RosterSyncEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(RosterSyncEngineApplication.class, args);
    }

}
