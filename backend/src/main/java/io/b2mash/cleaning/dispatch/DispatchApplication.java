package io.b2mash.cleaning.dispatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DispatchApplication {

  public static void main(String[] args) {
    SpringApplication.run(DispatchApplication.class, args);
  }
}
