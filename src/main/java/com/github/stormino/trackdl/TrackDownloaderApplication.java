package com.github.stormino.trackdl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TrackDownloaderApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrackDownloaderApplication.class, args);
    }
}
