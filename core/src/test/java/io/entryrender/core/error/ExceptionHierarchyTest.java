package io.entryrender.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Verifies the exception hierarchy: unchecked, phase-tagged, source-carrying. */
class ExceptionHierarchyTest {

    @Test
    @DisplayName("ProfileLoadException is a load-phase RenderException")
    void profileLoadException() {
        IOException cause = new IOException("disk");
        ProfileLoadException e = new ProfileLoadException("Failed to read profile YAML: disk", cause, "p.yaml");

        assertThat(e).isInstanceOf(RenderException.class).isInstanceOf(RuntimeException.class);
        assertThat(e.phase()).isEqualTo(RenderException.Phase.LOAD);
        assertThat(e.source()).isEqualTo("p.yaml");
        assertThat(e.detail()).isEqualTo(e.getMessage());
        assertThat(e.getCause()).isSameAs(cause);
    }

    @Test
    @DisplayName("SourceParseException is a render-phase RenderException without source")
    void sourceParseException() {
        SourceParseException e = new SourceParseException("Entry is not well-formed XML: eof", null);

        assertThat(e).isInstanceOf(RenderException.class);
        assertThat(e.phase()).isEqualTo(RenderException.Phase.RENDER);
        assertThat(e.source()).isNull();
    }
}
