package org.example.campusschedule;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CampusScheduleApplication {
    public static void main(String[] args) {
        SpringApplication.run(CampusScheduleApplication.class, args);
    }
}
