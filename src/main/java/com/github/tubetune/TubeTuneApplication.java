package com.github.tubetune;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class TubeTuneApplication {

    public static void main(String[] args) {
        SpringApplication.run(TubeTuneApplication.class, args);
    }
}
