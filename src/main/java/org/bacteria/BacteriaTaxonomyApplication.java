package org.bacteria;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BacteriaTaxonomyApplication {
    public static void main(String[] args) {
        SpringApplication.run(BacteriaTaxonomyApplication.class, args);
    }
}
