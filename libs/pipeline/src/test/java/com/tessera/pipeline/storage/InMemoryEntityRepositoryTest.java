package com.tessera.pipeline.storage;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryEntityRepository")
class InMemoryEntityRepositoryTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final InMemoryEntityRepository repository = new InMemoryEntityRepository();

    private static EntityRow row(String id, String userId, String workspaceId, long version) {
        return new EntityRow(
                id, userId, workspaceId, "note", "title " + id, null, null, null, null, null,
                List.of(), List.of(), Map.of(), version, T0, T0, null, "evt-" + version);
    }

    @Test
    @DisplayName("insertIfAbsent keeps the first row")
    void firstInsertWins() {
        EntityRow first = repository.insertIfAbsent(row("e1", "alice", null, 1));
        EntityRow second = repository.insertIfAbsent(row("e1", "mallory", null, 1));

        assertThat(second).isEqualTo(first);
        assertThat(repository.findById("e1").orElseThrow().userId()).isEqualTo("alice");
    }

    @Test
    @DisplayName("replace applies only at the expected version")
    void compareAndSet() {
        repository.insertIfAbsent(row("e1", "alice", null, 1));

        assertThat(repository.replace(row("e1", "alice", null, 2), 3)).isFalse();
        assertThat(repository.replace(row("e1", "alice", null, 2), 1)).isTrue();
        assertThat(repository.findById("e1").orElseThrow().version()).isEqualTo(2);
        assertThat(repository.replace(row("missing", "alice", null, 2), 1)).isFalse();
    }

    @Test
    @DisplayName("personal rows are visible to their owner, workspace rows to the workspace")
    void visibility() {
        repository.insertIfAbsent(row("mine", "alice", null, 1));
        repository.insertIfAbsent(row("theirs", "bob", null, 1));
        repository.insertIfAbsent(row("shared", "bob", "ws-1", 1));

        assertThat(repository.findVisible("alice", null)).extracting(EntityRow::id).containsExactly("mine");
        assertThat(repository.findVisible("alice", "ws-1")).extracting(EntityRow::id).containsExactly("shared");
    }

    @Test
    @DisplayName("soft delete bumps the version once and keeps the first timestamp")
    void softDelete() {
        repository.insertIfAbsent(row("e1", "alice", null, 1));

        repository.softDelete("e1", T0.plusSeconds(10), "delete-1");
        EntityRow again = repository.softDelete("e1", T0.plusSeconds(20), "delete-2").orElseThrow();

        assertThat(again.deletedAt()).isEqualTo(T0.plusSeconds(10));
        assertThat(again.version()).isEqualTo(2);
        assertThat(again.writtenBy("delete-1")).isTrue();
        assertThat(again.writtenBy("delete-2")).isFalse();
        assertThat(repository.findVisible("alice", null)).isEmpty();
        assertThat(repository.softDelete("missing", T0, "delete-3")).isEmpty();
    }

    @Test
    @DisplayName("object store checksums are prefixed SHA-256 hex")
    void checksum() {
        assertThat(Checksums.sha256("abc".getBytes(StandardCharsets.UTF_8)))
                .isEqualTo("sha256:ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");

        StoredObject stored =
                new InMemoryObjectStore("https://files.test")
                        .put("alice/notes/1.md", "abc".getBytes(StandardCharsets.UTF_8), "text/markdown");
        assertThat(stored.url()).isEqualTo("https://files.test/alice/notes/1.md");
        assertThat(stored.size()).isEqualTo(3);
    }
}
