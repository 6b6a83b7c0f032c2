package com.peopleanalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PeopleAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(PeopleAnalyticsApplication.class, args);
    }
}
