package com.pgschema.upgrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.r2dbc.R2dbcAutoConfiguration;

/**
 * Main application class for the schema upgrader command line tool.
 * The exit code comes from the command line runner.
 * R2DBC connections are opened per run by the reactive strategy, so no shared factory is configured.
 */
@SpringBootApplication(exclude = R2dbcAutoConfiguration.class)
public class PgSchemaUpgraderApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PgSchemaUpgraderApplication.class, args)));
    }
}
