package com.phillippitts.airplay.service.adapter.musicbrainz;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class StreamTitleTest {

    @Test
    void splitsOnFirstSeparator() {
        assertThat(StreamTitle.parse("  Daft Punk - One More Time - Radio Edit "))
                .contains(new StreamTitle("Daft Punk", "One More Time - Radio Edit"));
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"", "Radio One Jingle", " - Title", "Artist - ", "Artist-Title"})
    void rejectsTagsWithoutArtistAndTitle(String raw) {
        assertThat(StreamTitle.parse(raw)).isEmpty();
    }
}
