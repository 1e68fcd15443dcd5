package com.example.subtitlesync;

import com.example.subtitlesync.config.CommandLineOptions;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Downloads missing subtitles for the movies and episodes of a Plex server.
 */
@SpringBootApplication
public class SubtitleSyncApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(SubtitleSyncApplication.class,
                CommandLineOptions.toPropertyArguments(args))));
    }
}
