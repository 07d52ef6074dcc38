package com.phillippitts.dbprobe;

import com.phillippitts.dbprobe.config.logging.UncaughtExceptionLogger;
import com.phillippitts.dbprobe.config.properties.DatabaseProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(DatabaseProperties.class)
public class DbProbeApplication {

    public static void main(String[] args) {
        UncaughtExceptionLogger.install();
        SpringApplication.run(DbProbeApplication.class, args);
    }

}
