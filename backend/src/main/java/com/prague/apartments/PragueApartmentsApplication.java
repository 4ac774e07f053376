package com.prague.apartments;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PragueApartmentsApplication {

  public static void main(String[] args) {
    SpringApplication.run(PragueApartmentsApplication.class, args);
  }
}
