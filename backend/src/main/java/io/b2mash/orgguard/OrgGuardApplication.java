package io.b2mash.orgguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OrgGuardApplication {

  public static void main(String[] args) {
    SpringApplication.run(OrgGuardApplication.class, args);
  }
}
