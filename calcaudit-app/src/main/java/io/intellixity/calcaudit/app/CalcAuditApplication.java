package io.intellixity.calcaudit.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class CalcAuditApplication {
  public static void main(String[] args) {
    SpringApplication.run(CalcAuditApplication.class, args);
  }
}
