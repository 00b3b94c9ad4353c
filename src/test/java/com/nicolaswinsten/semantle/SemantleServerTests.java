package com.nicolaswinsten.semantle;

import java.util.List;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "semantle.vocabulary.location=classpath:vocabulary-test.json")
@AutoConfigureMockMvc
class SemantleServerTests {

    @Autowired
    MockMvc mvc;

    @Test
    void contextLoadsWithTestVocabulary() throws Exception {
        mvc.perform(get("/api"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.vocabulary_size").value(3));
    }

    @Test
    void playsAGameToCompletionAndRecordsIt() throws Exception {
        String created = mvc.perform(post("/api/game/new").param("debug", "true"))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();
        String sessionId = JsonPath.read(created, "$.session_id");
        String target = JsonPath.read(created, "$.target_word");
        String miss = List.of("cat", "dog", "car").stream().filter(w -> !w.equals(target)).findFirst().orElseThrow();

        mvc.perform(post("/api/game/guess")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"session_id\": \"" + sessionId + "\", \"word\": \"" + miss.toUpperCase() + "\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.is_correct").value(false))
            .andExpect(jsonPath("$.attempts").value(1));

        mvc.perform(post("/api/game/guess")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"session_id\": \"" + sessionId + "\", \"word\": \"" + target + "\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.is_correct").value(true))
            .andExpect(jsonPath("$.rank").value(1))
            .andExpect(jsonPath("$.similarity").value(1.0))
            .andExpect(jsonPath("$.attempts").value(2));

        mvc.perform(post("/api/game/guess")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"session_id\": \"" + sessionId + "\", \"word\": \"" + miss + "\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error_code").value("SessionAlreadyCompleted"));

        mvc.perform(get("/api/game/" + sessionId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.is_completed").value(true))
            .andExpect(jsonPath("$.target_word").value(target))
            .andExpect(jsonPath("$.attempts.length()").value(2))
            .andExpect(jsonPath("$.attempts[0].word").value(miss));

        String stats = mvc.perform(post("/api/stats/player-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"session_id\": \"" + sessionId + "\"}"))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();
        assertThat((Integer) JsonPath.read(stats, "$.total_games")).isEqualTo(1);
        assertThat((Integer) JsonPath.read(stats, "$.best_score")).isEqualTo(2);
    }

    @Test
    void unknownSessionIsNotFound() throws Exception {
        mvc.perform(post("/api/game/guess")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"session_id\": \"no-such-session\", \"word\": \"cat\"}"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error_code").value("SessionNotFound"));
    }

    @Test
    void validateIsCaseInsensitive() throws Exception {
        mvc.perform(get("/api/words/validate/Dog"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.valid").value(true));

        mvc.perform(get("/api/words/validate/zebra"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.valid").value(false));
    }

    @Test
    void dailyGamesShareATarget() throws Exception {
        String first = mvc.perform(post("/api/game/new").param("debug", "true")
                .contentType(MediaType.APPLICATION_JSON).content("{\"daily\": true}"))
            .andReturn().getResponse().getContentAsString();
        String second = mvc.perform(post("/api/game/new").param("debug", "true")
                .contentType(MediaType.APPLICATION_JSON).content("{\"daily\": true}"))
            .andReturn().getResponse().getContentAsString();

        assertThat((String) JsonPath.read(first, "$.target_word")).isEqualTo(JsonPath.read(second, "$.target_word"));
        assertThat((String) JsonPath.read(first, "$.session_id")).isNotEqualTo(JsonPath.read(second, "$.session_id"));
    }
}
