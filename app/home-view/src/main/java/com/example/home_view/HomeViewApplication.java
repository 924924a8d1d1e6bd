package com.example.home_view;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import(TimeConfig.class)
public class HomeViewApplication {

  public static void main(String[] args) {
    SpringApplication.run(HomeViewApplication.class, args);
  }
}
