package com.owldoor.geocoder;

import com.owldoor.geocoder.config.GeocodeJobRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@EnableConfigurationProperties
public class BulkGeocoderApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(BulkGeocoderApplication.class, args);
        // command-line job mode: exit with the job's status instead of staying up for HTTP triggers
        if (context.getBean(GeocodeJobRunner.class).hasRun()) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
