package org.jstats.cricketlens_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CricketlensApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(CricketlensApiApplication.class, args);
    }
}
