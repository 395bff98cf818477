package org.caureq.opsinsights.service.memory;

import org.caureq.opsinsights.TestClock;
import org.caureq.opsinsights.config.InsightsProps;
import org.caureq.opsinsights.domain.model.Change;
import org.caureq.opsinsights.domain.model.ChangeType;
import org.caureq.opsinsights.domain.model.ResourceSnapshot;
import org.caureq.opsinsights.service.persistence.StateFiles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ChangeDetectorTest {
    private static final Instant NOW = Instant.parse("2026-03-08T00:00:00Z");
    private static final long GIB = 1024L * 1024 * 1024;

    @TempDir
    Path dir;

    private TestClock clock;
    private ChangeDetector detector;

    @BeforeEach
    void setUp() {
        clock = new TestClock(NOW);
        detector = new ChangeDetector(InsightsProps.defaults(), new StateFiles(dir), clock);
    }

    private static ResourceSnapshot vm(String id, String node, String status, int cpus, long memGib) {
        return new ResourceSnapshot(id, "name-" + id, "qemu", node, status, cpus, memGib * GIB);
    }

    @Test
    void firstSnapshotOnlySeeds() {
        assertThat(detector.seeded()).isFalse();

        var changes = detector.detect(List.of(vm("qemu/101", "pve1", "running", 2, 4)));

        assertThat(changes).isEmpty();
        assertThat(detector.seeded()).isTrue();
        assertThat(detector.count()).isZero();
    }

    @Test
    void firstSnapshotCanBeReportedAsCreated() {
        var props = new InsightsProps(null, null, null, null, new InsightsProps.ChangeProps(null, null, true),
                null, null, null);
        var reporting = new ChangeDetector(props, new StateFiles(dir), clock);

        var changes = reporting.detect(List.of(vm("qemu/101", "pve1", "running", 2, 4),
                vm("qemu/102", "pve2", "stopped", 1, 2)));

        assertThat(changes).extracting(Change::type).containsOnly(ChangeType.CREATED);
        assertThat(changes).extracting(Change::resourceId).containsExactly("qemu/101", "qemu/102");
        assertThat(reporting.seeded()).isTrue();
        assertThat(reporting.detect(List.of(vm("qemu/101", "pve1", "running", 2, 4),
                vm("qemu/102", "pve2", "stopped", 1, 2)))).isEmpty();
    }

    @Test
    void identicalSnapshotYieldsNothing() {
        var snap = List.of(vm("qemu/101", "pve1", "running", 2, 4), vm("qemu/102", "pve2", "stopped", 1, 2));
        detector.detect(snap);

        assertThat(detector.detect(snap)).isEmpty();
        assertThat(detector.detect(new ArrayList<>(snap))).isEmpty();
    }

    @Test
    void createdAndDeletedResources() {
        detector.detect(List.of(vm("qemu/101", "pve1", "running", 2, 4)));

        var changes = detector.detect(List.of(vm("qemu/102", "pve1", "running", 2, 4)));

        assertThat(changes).extracting(Change::type).containsExactly(ChangeType.CREATED, ChangeType.DELETED);
        assertThat(changes.get(0).resourceId()).isEqualTo("qemu/102");
        assertThat(changes.get(0).description()).isEqualTo("name-qemu/102 created on pve1");
        assertThat(changes.get(1).after()).isNull();
        assertThat(changes.get(1).before().resourceId()).isEqualTo("qemu/101");
    }

    @Test
    void addRemoveAndMoveInOneSnapshot() {
        detector.detect(List.of(vm("qemu/101", "pve1", "running", 2, 4), vm("qemu/102", "pve1", "running", 1, 2)));

        var changes = detector.detect(List.of(vm("qemu/101", "pve2", "running", 2, 4),
                vm("qemu/103", "pve1", "running", 1, 2)));

        assertThat(changes).extracting(Change::type)
                .containsExactlyInAnyOrder(ChangeType.CREATED, ChangeType.DELETED, ChangeType.MIGRATED);
        assertThat(changes).extracting(Change::resourceId)
                .containsExactlyInAnyOrder("qemu/103", "qemu/102", "qemu/101");
        assertThat(changes).filteredOn(c -> c.type() == ChangeType.MIGRATED).singleElement()
                .satisfies(c -> assertThat(c.description()).isEqualTo("name-qemu/101 migrated pve1 -> pve2"));
    }

    @Test
    void oneResourceCanChangeSeveralWays() {
        detector.detect(List.of(vm("qemu/101", "pve1", "running", 2, 4)));

        var changes = detector.detect(List.of(vm("qemu/101", "pve2", "stopped", 4, 8)));

        assertThat(changes).extracting(Change::type)
                .containsExactly(ChangeType.CONFIG, ChangeType.STATUS, ChangeType.MIGRATED);
        assertThat(changes.get(0).description())
                .isEqualTo("name-qemu/101 config changed: cpus 2 -> 4, memory 4.0 GiB -> 8.0 GiB");
        assertThat(changes.get(1).description()).isEqualTo("name-qemu/101 status running -> stopped");
        assertThat(changes.get(2).description()).isEqualTo("name-qemu/101 migrated pve1 -> pve2");
        assertThat(changes).allSatisfy(c -> assertThat(c.detectedAt()).isEqualTo(NOW));
        assertThat(changes).extracting(Change::id).doesNotHaveDuplicates();
    }

    @Test
    void statusComparisonIgnoresCase() {
        detector.detect(List.of(vm("qemu/101", "pve1", "running", 2, 4)));

        assertThat(detector.detect(List.of(vm("qemu/101", "pve1", "RUNNING", 2, 4)))).isEmpty();
    }

    @Test
    void unknownFieldsAreNotCompared() {
        detector.detect(List.of(vm("qemu/101", "pve1", "running", 2, 4)));

        var partial = new ResourceSnapshot("qemu/101", "name-qemu/101", "qemu", null, null, null, null);
        assertThat(detector.detect(List.of(partial))).isEmpty();
    }

    @Test
    void emptySnapshotDeletesEverything() {
        detector.detect(List.of(vm("a", "pve1", "running", 1, 1), vm("b", "pve1", "running", 1, 1)));

        var changes = detector.detect(List.of());

        assertThat(changes).hasSize(2).allSatisfy(c -> assertThat(c.type()).isEqualTo(ChangeType.DELETED));
    }

    @Test
    void queriesReturnNewestFirst() {
        detector.detect(List.of(vm("a", "pve1", "running", 1, 1)));
        clock.advance(Duration.ofMinutes(1));
        detector.detect(List.of(vm("a", "pve1", "stopped", 1, 1)));
        clock.advance(Duration.ofMinutes(1));
        detector.detect(List.of(vm("a", "pve2", "stopped", 1, 1), vm("b", "pve1", "running", 1, 1)));

        var recent = detector.getRecent(10, null);
        assertThat(recent).extracting(Change::type)
                .containsExactly(ChangeType.CREATED, ChangeType.MIGRATED, ChangeType.STATUS);
        assertThat(detector.getRecent(10, NOW.plus(Duration.ofMinutes(2)))).hasSize(2);
        assertThat(detector.getForResource("a", 10)).extracting(Change::type)
                .containsExactly(ChangeType.MIGRATED, ChangeType.STATUS);
        assertThat(detector.getRecent(1, null)).hasSize(1);
    }

    @Test
    void oldestChangesAreEvicted() {
        var props = new InsightsProps(null, null, null, null, new InsightsProps.ChangeProps(3, null, null),
                null, null, null);
        var d = new ChangeDetector(props, new StateFiles(dir), clock);
        d.detect(List.of());
        for (int i = 0; i < 5; i++) {
            var snap = new ArrayList<ResourceSnapshot>();
            for (int j = 0; j <= i; j++) snap.add(vm("vm" + j, "pve1", "running", 1, 1));
            d.detect(snap);
        }

        assertThat(d.count()).isEqualTo(3);
        assertThat(d.getRecent(10, null)).extracting(Change::resourceId).containsExactly("vm4", "vm3", "vm2");
    }

    @Test
    void stateSurvivesRestart() {
        detector.detect(List.of(vm("a", "pve1", "running", 1, 1)));
        detector.detect(List.of(vm("a", "pve1", "stopped", 1, 1)));

        var reloaded = new ChangeDetector(InsightsProps.defaults(), new StateFiles(dir), clock);
        reloaded.load();

        assertThat(reloaded.seeded()).isTrue();
        assertThat(reloaded.getRecent(10, null)).isEqualTo(detector.getRecent(10, null));
        // diffs against the persisted snapshot, not a fresh seed
        assertThat(reloaded.detect(List.of(vm("a", "pve2", "stopped", 1, 1))))
                .extracting(Change::type).containsExactly(ChangeType.MIGRATED);
    }

    @Test
    void concurrentDetectionsSerialize() throws Exception {
        detector.detect(List.of());
        var snapshots = new ArrayList<List<ResourceSnapshot>>();
        for (int i = 0; i < 50; i++) {
            snapshots.add(i % 2 == 0
                    ? List.of(vm("a", "pve1", "running", 1, 1))
                    : List.of(vm("a", "pve1", "stopped", 1, 1)));
        }
        var all = Collections.synchronizedList(new ArrayList<Change>());
        var start = new CountDownLatch(1);
        var pool = Executors.newFixedThreadPool(4);
        for (var snap : snapshots) {
            pool.submit(() -> {
                start.await();
                all.addAll(detector.detect(snap));
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        // every change returned was also retained exactly once
        assertThat(detector.count()).isEqualTo(all.size());
        assertThat(all.stream().filter(c -> c.type() == ChangeType.CREATED)).hasSize(1);
    }
}
