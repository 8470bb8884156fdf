package org.iceforge.ocient.connector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OcientConnectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OcientConnectorApplication.class, args);
    }
}
