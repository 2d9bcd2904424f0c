package com.wear.stitch.core.stitcher;

import com.wear.stitch.core.frame.Frame;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

class RowHasherTest {

    private final RowHasher hasher = new RowHasher();

    @Test
    @DisplayName("Should hash the central band with the Horner polynomial seeded with 1")
    void hash_SolidRow_MatchesPolynomial() {
        Frame frame = Frame.solid(10, 2, 0xFF010203);

        RowHash hash = hasher.hash(frame);

        assertThat(hash.length()).isEqualTo(2);
        assertThat(hash.get(0)).isEqualTo(2034237505L);
        assertThat(hash.get(1)).isEqualTo(2034237505L);
        assertThat(hash.isDegenerate()).isFalse();
    }

    @Test
    @DisplayName("Should wrap modulo 2^64 and expose the unsigned value")
    void hash_LargeValues_WrapsModulo2To64() {
        Frame frame = Frame.solid(100, 1, 0xFFFFFFFF);

        RowHash hash = hasher.hash(frame);

        BigInteger modulo = BigInteger.ONE.shiftLeft(64);
        BigInteger expected = BigInteger.ONE;
        for (int x = 30; x < 70; x++) {
            expected = expected.multiply(BigInteger.valueOf(31)).add(BigInteger.valueOf(0xFFFFFF)).mod(modulo);
        }
        assertThat(hash.toUnsignedString(0)).isEqualTo(expected.toString()).isEqualTo("12976549085419870337");
    }

    @Test
    @DisplayName("Should ignore alpha and pixels outside the sampling band")
    void hash_PixelsOutsideBandOrAlpha_DoNotAffectHash() {
        Frame base = Frame.generate(20, 5, (x, y) -> 0xFF000000 | (y * 40) << 8 | x);
        Frame edited = Frame.generate(20, 5, (x, y) -> {
            if (x < RowHasher.bandStart(20) || x >= RowHasher.bandEnd(20)) {
                return 0xFFABCDEF;
            }
            return 0x10000000 | (y * 40) << 8 | x;
        });

        RowHash a = hasher.hash(base);
        RowHash b = hasher.hash(edited);

        for (int y = 0; y < 5; y++) {
            assertThat(b.get(y)).isEqualTo(a.get(y));
        }
    }

    @Test
    @DisplayName("Should change the hash when a pixel inside the band changes")
    void hash_PixelInsideBand_ChangesHash() {
        Frame base = Frame.solid(20, 1, 0xFF202020);
        Frame edited = Frame.generate(20, 1, (x, y) -> x == 10 ? 0xFF202021 : 0xFF202020);

        assertThat(hasher.hash(edited).get(0)).isNotEqualTo(hasher.hash(base).get(0));
    }

    @Test
    @DisplayName("Should be deterministic and identical in parallel mode")
    void hash_SameFrame_Deterministic() {
        Frame frame = Frame.generate(64, 48, (x, y) -> 0xFF000000 | (x * 31 + y * 17) * 2654435 & 0xFFFFFF);

        RowHash first = hasher.hash(frame);
        RowHash second = hasher.hash(frame);
        RowHash parallel = new RowHasher(true).hash(frame);

        for (int y = 0; y < 48; y++) {
            assertThat(second.get(y)).isEqualTo(first.get(y));
            assertThat(parallel.get(y)).isEqualTo(first.get(y));
        }
    }

    @Test
    @DisplayName("Should produce constant seed hashes and flag a frame too narrow for a band")
    void hash_WidthOne_IsDegenerate() {
        Frame frame = Frame.generate(1, 3, (x, y) -> 0xFF000000 | y);

        RowHash hash = hasher.hash(frame);

        assertThat(hash.isDegenerate()).isTrue();
        assertThat(hash.get(0)).isEqualTo(1L);
        assertThat(hash.get(1)).isEqualTo(1L);
        assertThat(hash.get(2)).isEqualTo(1L);
    }

    @Test
    @DisplayName("Should still sample one column when the frame is two pixels wide")
    void hash_WidthTwo_SamplesFirstColumn() {
        assertThat(RowHasher.bandStart(2)).isZero();
        assertThat(RowHasher.bandEnd(2)).isEqualTo(1);

        RowHash hash = hasher.hash(Frame.solid(2, 1, 0xFF000005));

        assertThat(hash.isDegenerate()).isFalse();
        assertThat(hash.get(0)).isEqualTo(31L + 5L);
    }
}
