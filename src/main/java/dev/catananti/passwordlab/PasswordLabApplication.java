package dev.catananti.passwordlab;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PasswordLabApplication {

    public static void main(String[] args) {
        SpringApplication.run(PasswordLabApplication.class, args);
    }
}
