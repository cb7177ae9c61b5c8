package com.bitcoin.bitcoin_exporter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BitcoinExporterApplication {

    public static void main(String[] args) {
        SpringApplication.run(BitcoinExporterApplication.class, args);
    }
}
