package org.example.flower_shop;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FlowerShopBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowerShopBotApplication.class, args);
    }
}
