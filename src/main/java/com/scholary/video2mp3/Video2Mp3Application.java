package com.scholary.video2mp3;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Video2Mp3Application {

  public static void main(String[] args) {
    SpringApplication.run(Video2Mp3Application.class, args);
  }
}
