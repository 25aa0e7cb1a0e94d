package com.flagship.flight_cover;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FlightCoverApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlightCoverApplication.class, args);
    }
}
