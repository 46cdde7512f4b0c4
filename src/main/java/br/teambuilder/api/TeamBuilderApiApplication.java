package br.teambuilder.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "br.teambuilder")
public class TeamBuilderApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(TeamBuilderApiApplication.class, args);
  }
}
