package com.meshnexus;

import com.meshnexus.config.MeshProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(MeshProperties.class)
public class MeshNexusApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeshNexusApplication.class, args);
    }
}
