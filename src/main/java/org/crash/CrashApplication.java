package org.crash;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CrashApplication {
    public static void main(String[] args) {
        SpringApplication.run(CrashApplication.class, args);
    }
}
