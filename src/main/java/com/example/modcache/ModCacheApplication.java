package com.example.modcache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

// storage wires its own connections; no auto-configured DataSource
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class ModCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModCacheApplication.class, args);
    }
}
