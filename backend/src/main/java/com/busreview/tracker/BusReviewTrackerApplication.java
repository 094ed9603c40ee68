package com.busreview.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BusReviewTrackerApplication {

  public static void main(String[] args) {
    SpringApplication.run(BusReviewTrackerApplication.class, args);
  }
}
