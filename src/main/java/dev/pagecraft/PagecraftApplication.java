package dev.pagecraft;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PagecraftApplication {

    public static void main(String[] args) {
        SpringApplication.run(PagecraftApplication.class, args);
    }
}
