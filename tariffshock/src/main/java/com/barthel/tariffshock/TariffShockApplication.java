package com.barthel.tariffshock;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TariffShockApplication {

    public static void main(String[] args) {
        SpringApplication.run(TariffShockApplication.class, args);
    }
}
