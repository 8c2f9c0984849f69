package com.alari.companion;

import com.alari.companion.config.AlariProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AlariProperties.class)
public class CompanionServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CompanionServiceApplication.class, args);
    }
}
