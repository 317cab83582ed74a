package com.sqlopt.optimizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SqlOptimizerApplication {

  public static void main(String[] args) {
    SpringApplication.run(SqlOptimizerApplication.class, args);
  }
}
