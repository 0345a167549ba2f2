package com.retailai.recommender;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RetailRecommenderApplication {

  public static void main(String[] args) {
    SpringApplication.run(RetailRecommenderApplication.class, args);
  }
}
