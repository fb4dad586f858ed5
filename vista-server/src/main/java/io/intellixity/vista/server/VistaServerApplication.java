package io.intellixity.vista.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class VistaServerApplication {
  public static void main(String[] args) {
    SpringApplication.run(VistaServerApplication.class, args);
  }
}
