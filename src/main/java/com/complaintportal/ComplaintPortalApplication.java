package com.complaintportal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ComplaintPortalApplication {

    public static void main(String[] args) {
        SpringApplication.run(ComplaintPortalApplication.class, args);
    }
}
