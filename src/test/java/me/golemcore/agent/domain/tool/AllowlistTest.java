package me.golemcore.agent.domain.tool;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AllowlistTest {

    private Allowlist allowlist;

    @BeforeEach
    void setUp() {
        allowlist = new Allowlist();
    }

    @Test
    void shouldRememberAddedKeys() {
        allowlist.add("shell:git");

        assertTrue(allowlist.has("shell:git"));
        assertFalse(allowlist.has("shell:rm"));
        assertEquals(1, allowlist.size());
    }

    @Test
    void shouldIgnoreNullAndBlankKeys() {
        allowlist.add(null);
        allowlist.add("  ");

        assertEquals(0, allowlist.size());
        assertFalse(allowlist.has(null));
    }

    @Test
    void shouldRemoveAndClear() {
        allowlist.add("edit:a.txt");
        allowlist.add("edit:b.txt");

        assertTrue(allowlist.remove("edit:a.txt"));
        assertFalse(allowlist.remove("edit:a.txt"));
        assertEquals(List.of("edit:b.txt"), allowlist.getAll());

        allowlist.clear();
        assertEquals(0, allowlist.size());
    }

    @Test
    void shouldReturnSortedCopy() {
        allowlist.add("tool:b");
        allowlist.add("shell:a");

        List<String> all = allowlist.getAll();
        all.clear();

        assertEquals(List.of("shell:a", "tool:b"), allowlist.getAll());
    }
}
