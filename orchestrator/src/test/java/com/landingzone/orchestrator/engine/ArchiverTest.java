package com.landingzone.orchestrator.engine;

import com.landingzone.orchestrator.storage.ObjectLocation;
import com.landingzone.orchestrator.storage.ObjectPattern;
import com.landingzone.orchestrator.support.InMemoryObjectStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for Archiver against an in-memory object store.
 */
class ArchiverTest {

    private static final ObjectPattern  SOURCE  = ObjectPattern.parse("gs://logistics_raw/input_data/logistics_*.csv");
    private static final ObjectLocation ARCHIVE = ObjectLocation.parse("gs://logistics_archive/");

    InMemoryObjectStore store;
    Archiver archiver;

    @BeforeEach
    void setUp() {
        store = new InMemoryObjectStore()
                .put("logistics_raw", "input_data/logistics_2024-06-01.csv")
                .put("logistics_raw", "input_data/logistics_2024-06-02.csv")
                .put("logistics_raw", "input_data/logistics_2024-06-03.csv")
                .put("logistics_raw", "input_data/readme.txt")
                .put("logistics_raw", "input_data/logistics_old/logistics_x.csv");
        archiver = new Archiver(store);
    }

    @Test
    void archive_movesOnlyMatchingObjects_keepingFileNames() {
        ExecutionResult result = archiver.archive(SOURCE, ARCHIVE);

        assertThat(result.isOk()).isTrue();
        assertThat(result.objectsAffected()).isEqualTo(3);
        assertThat(store.names("logistics_archive")).containsExactlyInAnyOrder(
                "logistics_2024-06-01.csv", "logistics_2024-06-02.csv", "logistics_2024-06-03.csv");
        // '*' does not cross '/', and non-csv files stay
        assertThat(store.names("logistics_raw")).containsExactlyInAnyOrder(
                "input_data/readme.txt", "input_data/logistics_old/logistics_x.csv");
    }

    @Test
    void archive_secondRunWithNothingNew_isOkWithZeroMoved() {
        archiver.archive(SOURCE, ARCHIVE);

        ExecutionResult again = archiver.archive(SOURCE, ARCHIVE);

        assertThat(again.isOk()).isTrue();
        assertThat(again.objectsAffected()).isZero();
        assertThat(store.names("logistics_archive")).hasSize(3);
    }

    @Test
    void archive_noMatches_failWhenEmpty_reportsFailure() {
        ExecutionResult result = archiver.archive(
                ObjectPattern.parse("gs://logistics_raw/input_data/*.parquet"), ARCHIVE, true);

        assertThat(result.status()).isEqualTo(ResultStatus.FAILED);
        assertThat(result.errorKind()).isEqualTo(ErrorKind.ARCHIVE_FAILED);
    }

    @Test
    void archive_oneObjectFails_othersMovedAndRerunFinishesTheJob() {
        store.failMovesOf("input_data/logistics_2024-06-02.csv");

        ExecutionResult first = archiver.archive(SOURCE, ARCHIVE);

        assertThat(first.status()).isEqualTo(ResultStatus.FAILED);
        assertThat(first.errorKind()).isEqualTo(ErrorKind.ARCHIVE_FAILED);
        assertThat(first.objectsAffected()).isEqualTo(2);
        assertThat(first.detail()).contains("logistics_2024-06-02.csv");

        store.clearFailures();
        ExecutionResult second = archiver.archive(SOURCE, ARCHIVE);

        assertThat(second.isOk()).isTrue();
        assertThat(second.objectsAffected()).isEqualTo(1);
        assertThat(store.names("logistics_archive")).hasSize(3);
    }

    @Test
    void archive_listingFails_reportsFailure() {
        store.setUnreachable(true);

        ExecutionResult result = archiver.archive(SOURCE, ARCHIVE);

        assertThat(result.status()).isEqualTo(ResultStatus.FAILED);
        assertThat(result.detail()).contains("Could not list");
    }

    @Test
    void archive_destinationWithFolder_prefixesTargetNames() {
        ExecutionResult result = archiver.archive(SOURCE, ObjectLocation.parse("gs://logistics_archive/2024"));

        assertThat(result.objectsAffected()).isEqualTo(3);
        assertThat(store.names("logistics_archive")).allMatch(n -> n.startsWith("2024/logistics_"));
    }

    @Test
    void archive_matchesSharingAFileName_leftInPlaceAndReported() {
        InMemoryObjectStore nested = new InMemoryObjectStore()
                .put("raw", "in/a/x.csv")
                .put("raw", "in/b/x.csv")
                .put("raw", "in/c/y.csv");

        ExecutionResult result = new Archiver(nested).archive(
                ObjectPattern.parse("gs://raw/in/**.csv"), ObjectLocation.parse("gs://archive/"));

        assertThat(result.status()).isEqualTo(ResultStatus.FAILED);
        assertThat(result.errorKind()).isEqualTo(ErrorKind.ARCHIVE_FAILED);
        assertThat(result.objectsAffected()).isEqualTo(1);
        assertThat(result.detail()).contains("in/a/x.csv").contains("in/b/x.csv");
        assertThat(nested.names("archive")).containsExactly("y.csv");
        assertThat(nested.names("raw")).containsExactlyInAnyOrder("in/a/x.csv", "in/b/x.csv");
    }

    @Test
    void archive_destinationIsSourceFolder_nothingMovedOrDeleted() {
        ExecutionResult result = archiver.archive(SOURCE, ObjectLocation.parse("gs://logistics_raw/input_data/"));

        assertThat(result.status()).isEqualTo(ResultStatus.FAILED);
        assertThat(result.objectsAffected()).isZero();
        assertThat(result.detail()).contains("same object");
        assertThat(store.names("logistics_raw")).contains(
                "input_data/logistics_2024-06-01.csv",
                "input_data/logistics_2024-06-02.csv",
                "input_data/logistics_2024-06-03.csv");
    }
}
