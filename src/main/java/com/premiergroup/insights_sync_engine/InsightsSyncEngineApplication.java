package com.premiergroup.insights_sync_engine;

import io.github.cdimascio.dotenv.Dotenv;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class InsightsSyncEngineApplication {

    public static void main(String[] args) {
        loadDotenv(Dotenv.configure().ignoreIfMissing().load());
        SpringApplication.run(InsightsSyncEngineApplication.class, args);
    }

    /**
     * Exposes entries of a local .env file (META_ACCESS_TOKEN, DB_PASSWORD, ...) as system properties.
     * Real environment variables and explicit -D flags win.
     */
    static void loadDotenv(Dotenv dotenv) {
        dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE).forEach(entry -> {
            if (System.getenv(entry.getKey()) == null && System.getProperty(entry.getKey()) == null) {
                System.setProperty(entry.getKey(), entry.getValue());
            }
        });
    }
}
