package org.jstats.pitchlens_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PitchLensApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(PitchLensApiApplication.class, args);
    }
}
