package com.groceryshopper.chat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GroceryChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(GroceryChatApplication.class, args);
    }
}
