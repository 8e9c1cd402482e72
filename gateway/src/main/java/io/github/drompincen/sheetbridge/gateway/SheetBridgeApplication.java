package io.github.drompincen.sheetbridge.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.sheetbridge")
@EnableMongoRepositories(basePackages = "io.github.drompincen.sheetbridge.persistence.repository")
@EnableScheduling
public class SheetBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(SheetBridgeApplication.class, args);
    }
}
