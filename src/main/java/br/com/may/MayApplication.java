package br.com.may;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MayApplication {

    public static void main(String[] args) {
        SpringApplication.run(MayApplication.class, args);
    }
}
