package com.photomosaic;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PhotoMosaicApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PhotoMosaicApplication.class, args)));
    }
}
