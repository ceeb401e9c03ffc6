package me.golemcore.agent.tools;

import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceTest {

    @TempDir
    Path tempDir;

    private Workspace workspace;

    @BeforeEach
    void setUp() {
        AgentProperties properties = new AgentProperties();
        properties.getTools().setWorkspace(tempDir.toString());
        workspace = new Workspace(properties);
    }

    @Test
    void shouldResolveRelativePathInsideWorkspace() {
        Optional<Path> resolved = workspace.resolve("src/Main.java");

        assertTrue(resolved.isPresent());
        assertEquals("src/Main.java", workspace.relativize(resolved.get()));
    }

    @Test
    void shouldResolveBlankToRoot() {
        assertEquals(workspace.getRoot(), workspace.resolve("").orElseThrow());
        assertEquals(workspace.getRoot(), workspace.resolve(null).orElseThrow());
        assertEquals(".", workspace.relativize(workspace.getRoot()));
    }

    @Test
    void shouldRejectTraversal() {
        assertTrue(workspace.resolve("../outside.txt").isEmpty());
        assertTrue(workspace.resolve("a/../../outside.txt").isEmpty());
    }

    @Test
    void shouldAllowDotSegmentsThatStayInside() {
        assertTrue(workspace.resolve("a/../b.txt").isPresent());
    }
}
