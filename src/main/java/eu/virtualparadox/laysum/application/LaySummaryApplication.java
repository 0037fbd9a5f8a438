package eu.virtualparadox.laysum.application;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "eu.virtualparadox.laysum")
public class LaySummaryApplication {

    public static void main(final String[] args) {
        SpringApplication.run(LaySummaryApplication.class, args);
    }
}
