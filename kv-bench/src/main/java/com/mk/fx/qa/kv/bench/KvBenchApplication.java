package com.mk.fx.qa.kv.bench;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KvBenchApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(KvBenchApplication.class, args)));
  }
}
