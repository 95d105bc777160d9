package com.github.spud.sample.ai.stylist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@EnableJpaRepositories
@SpringBootApplication
public class StylistAgentApplication {

  public static void main(String[] args) {
    SpringApplication.run(StylistAgentApplication.class, args);
  }

}
