package com.nicolaswinsten.semantle.web;

import com.nicolaswinsten.semantle.exception.InvalidWordException;
import com.nicolaswinsten.semantle.exception.SessionNotFoundException;
import com.nicolaswinsten.semantle.game.AttemptResult;
import com.nicolaswinsten.semantle.game.GuessEvaluator;
import com.nicolaswinsten.semantle.web.GameStompController.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GameStompControllerTest {

    @Mock
    SimpMessagingTemplate messagingTemplate;

    @Mock
    GuessEvaluator guessEvaluator;

    @Captor
    ArgumentCaptor<Object> messageCaptor;

    GameStompController controller;

    @BeforeEach
    void setUp() {
        controller = new GameStompController(messagingTemplate, guessEvaluator);
    }

    @Test
    void scoredGuessIsPublishedToAttempts() {
        when(guessEvaluator.submitGuess("s1", "dog"))
            .thenReturn(new AttemptResult("s1", "dog", 0.99, 2, false, 1));

        controller.guess(new GuessFrame("s1", "dog"));

        verify(messagingTemplate).convertAndSend(eq("/topic/game/s1/attempts"), messageCaptor.capture());
        AttemptMessage msg = (AttemptMessage) messageCaptor.getValue();
        assertThat(msg.word()).isEqualTo("dog");
        assertThat(msg.rank()).isEqualTo(2);
        assertThat(msg.correct()).isFalse();
        assertThat(msg.attempts()).isEqualTo(1);
        verifyNoMoreInteractions(messagingTemplate);
    }

    @Test
    void winningGuessAlsoPublishesCompletedStatus() {
        when(guessEvaluator.submitGuess("s1", "cat"))
            .thenReturn(new AttemptResult("s1", "cat", 1.0, 1, true, 3));

        controller.guess(new GuessFrame("s1", "cat"));

        verify(messagingTemplate).convertAndSend(eq("/topic/game/s1/attempts"), any(AttemptMessage.class));
        verify(messagingTemplate).convertAndSend(eq("/topic/game/s1/status"), messageCaptor.capture());
        StatusMessage msg = (StatusMessage) messageCaptor.getValue();
        assertThat(msg.sessionId()).isEqualTo("s1");
        assertThat(msg.status()).isEqualTo(GameStatus.COMPLETED);
        assertThat(msg.attempts()).isEqualTo(3);
    }

    @Test
    void rejectedGuessIsPublishedToErrors() {
        when(guessEvaluator.submitGuess("s1", "zzz")).thenThrow(new InvalidWordException("zzz"));

        controller.guess(new GuessFrame("s1", "zzz"));

        verify(messagingTemplate).convertAndSend(eq("/topic/game/s1/errors"), messageCaptor.capture());
        ErrorMessage msg = (ErrorMessage) messageCaptor.getValue();
        assertThat(msg.errorCode()).isEqualTo("InvalidWord");
        verifyNoMoreInteractions(messagingTemplate);
    }

    @Test
    void unknownSessionIsPublishedToErrors() {
        when(guessEvaluator.submitGuess("gone", "dog")).thenThrow(new SessionNotFoundException("gone"));

        controller.guess(new GuessFrame("gone", "dog"));

        verify(messagingTemplate).convertAndSend(eq("/topic/game/gone/errors"), messageCaptor.capture());
        assertThat(((ErrorMessage) messageCaptor.getValue()).errorCode()).isEqualTo("SessionNotFound");
    }

    @Test
    void sessionIdIsTrimmed() {
        when(guessEvaluator.submitGuess("s1", "dog"))
            .thenReturn(new AttemptResult("s1", "dog", 0.99, 2, false, 1));

        controller.guess(new GuessFrame(" s1 ", "dog"));

        verify(messagingTemplate).convertAndSend(eq("/topic/game/s1/attempts"), any(AttemptMessage.class));
    }

    @Test
    void nullFrameIsIgnored() {
        controller.guess(null);
        verifyNoInteractions(messagingTemplate, guessEvaluator);
    }

    @Test
    void blankSessionIsIgnored() {
        controller.guess(new GuessFrame("  ", "dog"));
        verifyNoInteractions(messagingTemplate, guessEvaluator);
    }

    @Test
    void missingWordIsIgnored() {
        controller.guess(new GuessFrame("s1", null));
        verifyNoInteractions(messagingTemplate, guessEvaluator);
    }
}
