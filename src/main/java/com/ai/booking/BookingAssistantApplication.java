package com.ai.booking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "com.ai.booking.config")
public class BookingAssistantApplication {

    public static void main(String[] args) {
        SpringApplication.run(BookingAssistantApplication.class, args);
    }
}
