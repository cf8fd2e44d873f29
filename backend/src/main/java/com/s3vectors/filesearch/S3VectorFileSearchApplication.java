package com.s3vectors.filesearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class S3VectorFileSearchApplication {

  public static void main(String[] args) {
    SpringApplication.run(S3VectorFileSearchApplication.class, args);
  }
}
