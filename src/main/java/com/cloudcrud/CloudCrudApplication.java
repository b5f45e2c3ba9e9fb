package com.cloudcrud;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

/**
 * Cloud CRUD functions server.
 * Generic named-function CRUD and query API over a document store.
 */
@SpringBootApplication(exclude = MongoAutoConfiguration.class)
public class CloudCrudApplication {
    public static void main(String[] args) {
        SpringApplication.run(CloudCrudApplication.class, args);
    }
}
