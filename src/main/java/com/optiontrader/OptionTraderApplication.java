package com.optiontrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OptionTraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(OptionTraderApplication.class, args);
    }
}
