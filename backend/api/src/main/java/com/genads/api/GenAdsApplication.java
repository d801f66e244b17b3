package com.genads.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;

@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class GenAdsApplication {

    public static void main(String[] args) {
        SpringApplication.run(GenAdsApplication.class, args);
    }
}
