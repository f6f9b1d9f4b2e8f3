package com.ryuqq.devloop.adapter.inmemory.workspace;

import com.ryuqq.devloop.core.check.Change;
import com.ryuqq.devloop.core.model.StartMarker;
import com.ryuqq.devloop.core.spi.WorkspaceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryWorkspace 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryWorkspaceTest {

    private InMemoryWorkspace workspace;

    @BeforeEach
    void setUp() {
        workspace = new InMemoryWorkspace();
        workspace.write("src/App.java", "class App {}");
        workspace.write("README.md", "readme");
    }

    @Test
    void changeSince_reportsAddedModifiedAndDeletedPaths() {
        // Given
        StartMarker marker = workspace.mark();

        // When
        workspace.write("src/App.java", "class App { int limit; }");
        workspace.write("src/RateLimiter.java", "class RateLimiter {}");
        workspace.delete("README.md");
        Change change = workspace.changeSince(marker);

        // Then
        assertThat(change.paths()).containsExactly("README.md", "src/App.java", "src/RateLimiter.java");
        assertThat(change.diff()).contains("--- deleted README.md", "+++ added src/RateLimiter.java");
    }

    @Test
    void changeSince_noEdits_isEmpty() {
        StartMarker marker = workspace.mark();

        assertThat(workspace.changeSince(marker).isEmpty()).isTrue();
    }

    @Test
    void softRevert_restoresMarkedStateAndPreservesCurrentWork() {
        // Given
        StartMarker marker = workspace.mark();
        workspace.write("src/App.java", "broken");

        // When
        String preserved = workspace.softRevert(marker);

        // Then
        assertThat(workspace.read("src/App.java")).contains("class App {}");
        StartMarker preservedMarker = new StartMarker(preserved, marker.branch(), Instant.EPOCH);
        workspace.hardRevert(preservedMarker);
        assertThat(workspace.read("src/App.java")).contains("broken");
    }

    @Test
    void hardRevert_discardsChanges() {
        StartMarker marker = workspace.mark();
        workspace.write("src/Extra.java", "class Extra {}");

        workspace.hardRevert(marker);

        assertThat(workspace.files()).containsExactly("README.md", "src/App.java");
    }

    @Test
    void unknownMarker_throwsWorkspaceException() {
        StartMarker foreign = new StartMarker("abc123", "main", Instant.EPOCH);

        assertThatThrownBy(() -> workspace.changeSince(foreign))
            .isInstanceOf(WorkspaceException.class)
            .hasMessageContaining("abc123");
    }
}
