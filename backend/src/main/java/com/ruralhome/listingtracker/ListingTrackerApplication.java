package com.ruralhome.listingtracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ListingTrackerApplication {

  public static void main(String[] args) {
    SpringApplication.run(ListingTrackerApplication.class, args);
  }
}
