package com.cloudcrud.config;

import com.cloudcrud.config.serializer.FieldValueSerializer;
import com.cloudcrud.model.FieldValue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application configuration for the cloud CRUD functions
 */
@Configuration
@EnableConfigurationProperties(CloudCrudProperties.class)
public class CloudCrudConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(CloudCrudConfiguration.class);

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        SimpleModule fieldValueModule = new SimpleModule();
        fieldValueModule.addSerializer(FieldValue.class, new FieldValueSerializer());
        mapper.registerModule(fieldValueModule);

        return mapper;
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "cloudcrud.store.type", havingValue = "mongodb")
    public MongoClient mongoClient(CloudCrudProperties properties) {
        logger.info("Connecting document store to {}", properties.getStore().getMongoUri());
        return MongoClients.create(properties.getStore().getMongoUri());
    }

    @Bean
    @ConditionalOnProperty(name = "cloudcrud.store.type", havingValue = "mongodb")
    public MongoDatabase mongoDatabase(MongoClient mongoClient, CloudCrudProperties properties) {
        return mongoClient.getDatabase(properties.getStore().getDatabase());
    }
}
