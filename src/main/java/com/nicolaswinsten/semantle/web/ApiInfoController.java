package com.nicolaswinsten.semantle.web;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import com.nicolaswinsten.semantle.game.GameService;

/**
 * Liveness and discovery endpoints. Not part of the game logic.
 */
@RestController
public class ApiInfoController {

    static final String VERSION = "1.0.0";

    private final GameService gameService;

    public ApiInfoController(GameService gameService) {
        this.gameService = gameService;
    }

    /** Returns {@code {"message": "Semantle API is running"}}. */
    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("message", "Semantle API is running");
    }

    /** Lists the endpoints and the loaded vocabulary size. */
    @GetMapping("/api")
    public Map<String, Object> info() {
        Map<String, String> game = new LinkedHashMap<>();
        game.put("new", "POST /api/game/new");
        game.put("guess", "POST /api/game/guess");
        game.put("session", "GET /api/game/{session_id}");

        Map<String, Object> endpoints = new LinkedHashMap<>();
        endpoints.put("game", game);
        endpoints.put("stats", "GET|POST /api/stats/{user_id}");
        endpoints.put("words", "GET /api/words/validate/{word}");
        endpoints.put("websocket", "/ws (STOMP: /app/guess)");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Semantle API");
        body.put("version", VERSION);
        body.put("vocabulary_size", gameService.vocabularySize());
        body.put("endpoints", endpoints);
        return body;
    }
}
