package com.clarity.serving;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Clarity Serving - actigraphy model serving with result caching,
 * request batching and versioned model lifecycle.
 */
@SpringBootApplication
public class ClarityServingApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClarityServingApplication.class, args);
    }
}
