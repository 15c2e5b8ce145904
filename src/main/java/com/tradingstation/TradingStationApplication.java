package com.tradingstation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TradingStationApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradingStationApplication.class, args);
    }
}
