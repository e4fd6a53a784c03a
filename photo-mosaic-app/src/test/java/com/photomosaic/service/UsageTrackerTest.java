package com.photomosaic.service;

import com.photomosaic.model.PhotoRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UsageTrackerTest {

    private UsageTracker usedTiles;
    private PhotoRecord dark;
    private PhotoRecord twin;

    @BeforeEach
    void setUp() {
        usedTiles = new UsageTracker();
        dark = new PhotoRecord(Path.of("dark.jpg"), Path.of("tmp/dark_grey.png"), 20);
        // Same paths and brightness, still a different tile
        twin = new PhotoRecord(Path.of("dark.jpg"), Path.of("tmp/dark_grey.png"), 20);
    }

    @Nested
    @DisplayName("assign")
    class Assign {

        @Test
        void storedRecordIsReturned() {
            usedTiles.assign(3, 7, dark);

            assertThat(usedTiles.recordAt(3, 7)).containsSame(dark);
            assertThat(usedTiles.recordAt(7, 3)).isEmpty();
            assertThat(usedTiles.size()).isEqualTo(1);
        }

        @Test
        void reassigningSameRecordIsAllowed() {
            usedTiles.assign(1, 1, dark);
            usedTiles.assign(1, 1, dark);

            assertThat(usedTiles.size()).isEqualTo(1);
        }

        @Test
        void assigningDifferentRecordToFilledCellFails() {
            usedTiles.assign(1, 1, dark);

            assertThatThrownBy(() -> usedTiles.assign(1, 1, twin))
                .isInstanceOf(UsageTracker.DuplicateAssignmentException.class)
                .hasMessageContaining("(1, 1)");
            assertThat(usedTiles.recordAt(1, 1)).containsSame(dark);
        }
    }

    @Nested
    @DisplayName("isUsedNearby")
    class IsUsedNearby {

        @Test
        void trueEverywhereInsideSquareNeighbourhood() {
            usedTiles.assign(5, 5, dark);

            for (int x = 3; x <= 7; x++) {
                for (int y = 3; y <= 7; y++) {
                    assertThat(usedTiles.isUsedNearby(2, x, y, dark)).as("(%d, %d)", x, y).isTrue();
                }
            }
        }

        @Test
        void falseOutsideRadius() {
            usedTiles.assign(5, 5, dark);

            assertThat(usedTiles.isUsedNearby(2, 8, 5, dark)).isFalse();
            assertThat(usedTiles.isUsedNearby(2, 5, 2, dark)).isFalse();
            assertThat(usedTiles.isUsedNearby(2, 2, 8, dark)).isFalse();
        }

        @Test
        void radiusZeroOnlyChecksTheCellItself() {
            usedTiles.assign(0, 0, dark);

            assertThat(usedTiles.isUsedNearby(0, 0, 0, dark)).isTrue();
            assertThat(usedTiles.isUsedNearby(0, 1, 0, dark)).isFalse();
        }

        @Test
        void comparesRecordsByIdentity() {
            usedTiles.assign(0, 0, dark);

            assertThat(usedTiles.isUsedNearby(4, 1, 1, twin)).isFalse();
        }

        @Test
        void hugeRadiusStillFindsNeighbour() {
            usedTiles.assign(1, 0, dark);

            assertThat(usedTiles.isUsedNearby(Integer.MAX_VALUE, 1, 1, dark)).isTrue();
            assertThat(usedTiles.isUsedNearby(Integer.MAX_VALUE, Integer.MAX_VALUE, Integer.MAX_VALUE, dark)).isTrue();
            assertThat(usedTiles.isUsedNearby(Integer.MAX_VALUE, 1, 1, twin)).isFalse();
        }

        @Test
        void denseGridChecksOnlyTheNeighbourhood() {
            PhotoRecord[][] grid = new PhotoRecord[10][10];
            for (int x = 0; x < 10; x++) {
                for (int y = 0; y < 10; y++) {
                    grid[x][y] = new PhotoRecord(Path.of("p.jpg"), Path.of("tmp/p_grey.png"), x + y);
                    usedTiles.assign(x, y, grid[x][y]);
                }
            }

            assertThat(usedTiles.isUsedNearby(1, 5, 5, grid[6][4])).isTrue();
            assertThat(usedTiles.isUsedNearby(1, 5, 5, grid[7][5])).isFalse();
            assertThat(usedTiles.isUsedNearby(1, 0, 0, grid[1][1])).isTrue();
            assertThat(usedTiles.isUsedNearby(1, 0, 0, grid[0][2])).isFalse();
        }

        @Test
        void falseWhenNothingAssigned() {
            assertThat(usedTiles.isUsedNearby(4, 0, 0, dark)).isFalse();
        }
    }
}
