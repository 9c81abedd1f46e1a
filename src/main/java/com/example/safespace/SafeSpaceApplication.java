package com.example.safespace;

import com.example.safespace.config.PromptProperties;
import com.example.safespace.config.RetryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({PromptProperties.class, RetryProperties.class})
public class SafeSpaceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SafeSpaceApplication.class, args);
    }

}
