package com.moviemart.cms;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ContentManagementApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContentManagementApplication.class, args);
    }
}
