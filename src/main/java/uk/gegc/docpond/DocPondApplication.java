package uk.gegc.docpond;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DocPondApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocPondApplication.class, args);
    }
}
