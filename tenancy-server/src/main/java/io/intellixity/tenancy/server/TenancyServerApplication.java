package io.intellixity.tenancy.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TenancyServerApplication {
  public static void main(String[] args) {
    SpringApplication.run(TenancyServerApplication.class, args);
  }
}
