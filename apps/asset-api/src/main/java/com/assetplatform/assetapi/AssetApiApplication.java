package com.assetplatform.assetapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AssetApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(AssetApiApplication.class, args);
  }
}
