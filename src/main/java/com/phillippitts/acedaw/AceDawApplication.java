package com.phillippitts.acedaw;

import com.phillippitts.acedaw.config.properties.ArchiveProperties;
import com.phillippitts.acedaw.config.properties.StorageProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        StorageProperties.class,
        ArchiveProperties.class
})
public class AceDawApplication {

    public static void main(String[] args) {
        SpringApplication.run(AceDawApplication.class, args);
    }

}
