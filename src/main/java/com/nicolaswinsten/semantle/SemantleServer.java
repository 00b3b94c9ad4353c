package com.nicolaswinsten.semantle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.nicolaswinsten.semantle.config.SemantleProperties;

/**
 * Entry point for the Semantle semantic word-guessing game.
 *
 * <p>Players guess words and get back how close each guess is to a hidden target, as a cosine
 * similarity and as a rank over the whole vocabulary. Games are played over REST
 * ({@code /api/**}) or STOMP/WebSocket ({@code /ws}).
 * There is no database; all game state lives in memory for the lifetime of the process.
 *
 * @see com.nicolaswinsten.semantle.config.EngineConfig  engine wiring
 * @see com.nicolaswinsten.semantle.web.GameController  REST surface
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(SemantleProperties.class)
public class SemantleServer {
    public static void main(String[] args) {
        SpringApplication.run(SemantleServer.class, args);
    }
}
