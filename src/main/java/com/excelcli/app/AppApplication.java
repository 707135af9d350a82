package com.excelcli.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;

/**
 * Starts excel-cli.
 * - {@code excel-cli <input.csv>}: evaluate one file and exit
 * - {@code excel-cli --server}: serve the REST endpoints under /table
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AppApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(AppApplication.class);
        boolean server = Arrays.asList(args).contains("--server");
        if (!server) {
            application.setWebApplicationType(WebApplicationType.NONE);
        }
        ConfigurableApplicationContext context = application.run(args);
        if (!server) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
