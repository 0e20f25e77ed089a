package com.routelab.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RouteLabApplication {

  public static void main(String[] args) {
    SpringApplication.run(RouteLabApplication.class, args);
  }
}
