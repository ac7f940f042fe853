package io.github.drompincen.annostore.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.annostore")
@EnableMongoRepositories(basePackages = "io.github.drompincen.annostore.persistence.repository")
public class AnnoStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnnoStoreApplication.class, args);
    }
}
