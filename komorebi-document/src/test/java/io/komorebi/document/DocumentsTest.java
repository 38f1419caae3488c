package io.komorebi.document;

import io.komorebi.common.ByteArray;
import io.komorebi.common.Mutation;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DocumentsTest {

    private final Documents documents = new Documents(DocumentConfig.defaults()
        .withClock(Clock.fixed(Instant.ofEpochMilli(5_000L), ZoneOffset.UTC))
        .withQualifierGenerator(QualifierGenerator.sequential("id-")));

    @Test
    void buildersDrawQualifiersFromConfig() {
        View view = documents.view("hello").family("idx").build();
        Component component = documents.component("d1", "text").view(view).build();

        assertThat(view.qualifier()).isEqualTo(ByteArray.of("id-0"));
        assertThat(component.qualifier()).isEqualTo(ByteArray.of("id-1"));
    }

    @Test
    void revisionsUseConfiguredClock() {
        Component component = documents.component("d1", "text").content("hello").build();

        Revision revision = documents.revision(List.of(component));
        RevisionDelete delete = documents.delete(List.of(revision.manifests().get(0).encode()));

        assertThat(revision.timestampMs()).isEqualTo(5_000L);
        assertThat(delete.timestampMs()).isEqualTo(5_000L);
        assertThat(delete.mutations()).extracting(Mutation::key)
            .containsExactly(component.key(), component.metadataKey());
    }

    @Test
    void defaultsUseRandomQualifiers() {
        Documents defaults = Documents.create();

        assertThat(defaults.config().qualifierGenerator()).isSameAs(QualifierGenerator.random());
        assertThat(defaults.view("a").build().qualifier().length()).isEqualTo(32);
    }

    @Test
    void configRejectsNulls() {
        assertThatThrownBy(() -> DocumentConfig.defaults().withClock(null))
            .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> DocumentConfig.defaults().withQualifierGenerator(null))
            .isInstanceOf(NullPointerException.class);
    }
}
