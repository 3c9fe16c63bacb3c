package com.deepansh.adventure.session;

import com.deepansh.adventure.engine.GameEngine;
import com.deepansh.adventure.engine.GameEngineException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VocabularyIndexTest {

    @Mock GameEngine engine;

    @Test
    void longWord_matchesTruncatedDictionaryToken() {
        when(engine.getDictionary()).thenReturn(List.of("lamp", "lanter", "leafle"));
        VocabularyIndex index = new VocabularyIndex(engine);

        assertThat(index.matches("Lantern")).containsExactly("lanter");
    }

    @Test
    void shortWord_usesWholeWordAsPrefix() {
        when(engine.getDictionary()).thenReturn(List.of("xyzzy", "xyz", "yell"));
        VocabularyIndex index = new VocabularyIndex(engine);

        assertThat(index.matches("xyz")).containsExactly("xyzzy", "xyz");
    }

    @Test
    void check_unknownWord_negativeReport() {
        when(engine.getDictionary()).thenReturn(List.of("north", "lamp", "xyzzy"));
        VocabularyIndex index = new VocabularyIndex(engine);

        // first six letters "xyzzyq" are not a prefix of "xyzzy"
        assertThat(index.check("xyzzyqq"))
                .isEqualTo("No, the game does NOT understand the word 'xyzzyqq'. Try a different synonym.");
    }

    @Test
    void check_knownWord_positiveReportListsMatches() {
        when(engine.getDictionary()).thenReturn(List.of("north", "xyzzy"));
        VocabularyIndex index = new VocabularyIndex(engine);

        assertThat(index.check("xyzzy"))
                .isEqualTo("Yes, the game understands 'xyzzy' (matches: xyzzy).");
    }

    @Test
    void engineFailure_propagates() {
        when(engine.getDictionary()).thenThrow(new GameEngineException("engine dictionary failed"));
        VocabularyIndex index = new VocabularyIndex(engine);

        assertThatThrownBy(() -> index.check("lamp")).isInstanceOf(GameEngineException.class);
    }
}
