package com.phillippitts.shato;

import com.phillippitts.shato.config.properties.GenerationProperties;
import com.phillippitts.shato.config.properties.HttpClientProperties;
import com.phillippitts.shato.config.properties.ValidatorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        GenerationProperties.class,
        ValidatorProperties.class,
        HttpClientProperties.class
})
public class ShatoApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShatoApplication.class, args);
    }

}
