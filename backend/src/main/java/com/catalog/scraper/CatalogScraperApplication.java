package com.catalog.scraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CatalogScraperApplication {

  public static void main(String[] args) {
    SpringApplication.run(CatalogScraperApplication.class, args);
  }
}
