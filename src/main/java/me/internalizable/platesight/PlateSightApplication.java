package me.internalizable.platesight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PlateSightApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlateSightApplication.class, args);
    }
}
