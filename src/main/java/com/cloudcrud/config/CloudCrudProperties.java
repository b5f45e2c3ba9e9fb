package com.cloudcrud.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under the {@code cloudcrud} prefix
 */
@Data
@ConfigurationProperties(prefix = "cloudcrud")
public class CloudCrudProperties {

    private Store store = new Store();
    private Query query = new Query();
    private Filters filters = new Filters();
    private Schema schema = new Schema();
    private Server server = new Server();

    @Data
    public static class Store {
        /**
         * memory or mongodb
         */
        private String type = "memory";
        private String mongoUri = "mongodb://localhost:27017";
        private String database = "cloudcrud";
    }

    @Data
    public static class Query {
        private int defaultLimit = 100;
        /**
         * Upper bound applied to requested page sizes; unset means no bound
         */
        private Integer maxLimit;
    }

    @Data
    public static class Filters {
        private boolean rejectUnknownOperators = false;
    }

    @Data
    public static class Schema {
        /**
         * Also insert one record carrying the initial fields when a table is created with a schema
         */
        private boolean legacySeedRecord = false;
    }

    @Data
    public static class Server {
        private String version = "4.10.4";
        private boolean liveQueries = true;
        private boolean redisCache = true;
        private boolean dashboard = true;
        private boolean publicAccess = true;
    }
}
