import org.euler.convention.AxisCode;
import org.euler.decompose.EulerComposer;
import org.euler.decompose.EulerDecomposer;
import org.euler.model.AngleTriple;
import org.euler.model.Matrix3;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EulerComposer / EulerDecomposer over all 24 axis codes.
 */
public class EulerDecomposerTest {

    private static final double TOL = 1e-10;

    // ----------------------------
    // Helpers
    // ----------------------------

    private static List<AxisCode> allCodes() {
        List<AxisCode> out = new ArrayList<>();
        for (int f = 0; f < 2; f++) {
            for (int i = 0; i < 3; i++) {
                for (int p = 0; p < 2; p++) {
                    for (int r = 0; r < 2; r++) {
                        out.add(AxisCode.of(i, p, r, f));
                    }
                }
            }
        }
        return out;
    }

    private static AxisCode code(String name) {
        for (AxisCode c : allCodes()) {
            if (c.conventionName().equals(name)) return c;
        }
        throw new IllegalArgumentException(name);
    }

    private static Matrix3 rx(double a) {
        return Matrix3.of(1, 0, 0, 0, Math.cos(a), -Math.sin(a), 0, Math.sin(a), Math.cos(a));
    }

    private static Matrix3 ry(double a) {
        return Matrix3.of(Math.cos(a), 0, Math.sin(a), 0, 1, 0, -Math.sin(a), 0, Math.cos(a));
    }

    private static Matrix3 rz(double a) {
        return Matrix3.of(Math.cos(a), -Math.sin(a), 0, Math.sin(a), Math.cos(a), 0, 0, 0, 1);
    }

    private static AngleTriple randomTriple(Random rnd) {
        return new AngleTriple(
                (rnd.nextDouble() * 2 - 1) * Math.PI,
                (rnd.nextDouble() * 2 - 1) * Math.PI,
                (rnd.nextDouble() * 2 - 1) * Math.PI
        );
    }

    private static double angleDistance(double a, double b) {
        return Math.abs(Math.IEEEremainder(a - b, 2 * Math.PI));
    }

    private static void assertTriple(double a, double b, double c, AngleTriple actual) {
        assertEquals(a, actual.first(), 1e-12, actual::toString);
        assertEquals(b, actual.second(), 1e-12, actual::toString);
        assertEquals(c, actual.third(), 1e-12, actual::toString);
    }

    // ----------------------------
    // Identity and meaning of the codes
    // ----------------------------

    @Nested
    class Identity {

        @Test
        void zeroAngles_composeToExactIdentity() {
            for (AxisCode code : allCodes()) {
                Matrix3 m = EulerComposer.compose(AngleTriple.ZERO, code);
                assertEquals(0.0, m.maxAbsDifference(Matrix3.identity()), code.toString());
            }
        }

        @Test
        void identity_decomposesToZeroAngles() {
            for (AxisCode code : allCodes()) {
                AngleTriple t = EulerDecomposer.decompose(Matrix3.identity(), code);
                assertEquals(0.0, Math.abs(t.first()), code.toString());
                assertEquals(0.0, Math.abs(t.second()), code.toString());
                assertEquals(0.0, Math.abs(t.third()), code.toString());
            }
        }
    }

    @Nested
    class Semantics {

        @Test
        @DisplayName("rotating frame: first angle is applied last to column vectors")
        void zyxRotating() {
            Matrix3 m = EulerComposer.compose(new AngleTriple(0.3, -0.5, 1.1), code("ZYXr"));
            assertTrue(m.maxAbsDifference(rz(0.3).multiply(ry(-0.5)).multiply(rx(1.1))) < 1e-12);
        }

        @Test
        @DisplayName("static frame: first angle is applied first to column vectors")
        void xyzStatic() {
            Matrix3 m = EulerComposer.compose(new AngleTriple(0.3, -0.5, 1.1), code("XYZs"));
            assertTrue(m.maxAbsDifference(rz(1.1).multiply(ry(-0.5)).multiply(rx(0.3))) < 1e-12);
        }

        @Test
        void oddParityAndRepetition() {
            Matrix3 xzy = EulerComposer.compose(new AngleTriple(0.3, -0.5, 1.1), code("XZYs"));
            assertTrue(xzy.maxAbsDifference(ry(1.1).multiply(rz(-0.5)).multiply(rx(0.3))) < 1e-12);

            Matrix3 zxz = EulerComposer.compose(new AngleTriple(0.3, -0.5, 1.1), code("ZXZr"));
            assertTrue(zxz.maxAbsDifference(rz(0.3).multiply(rx(-0.5)).multiply(rz(1.1))) < 1e-12);

            Matrix3 zyz = EulerComposer.compose(new AngleTriple(0.3, -0.5, 1.1), code("ZYZr"));
            assertTrue(zyz.maxAbsDifference(rz(0.3).multiply(ry(-0.5)).multiply(rz(1.1))) < 1e-12);
        }

        @Test
        void composedMatrices_areRotations() {
            Random rnd = new Random(7);
            for (AxisCode code : allCodes()) {
                Matrix3 m = EulerComposer.compose(randomTriple(rnd), code);
                assertTrue(m.isRotation(1e-12), code.toString());
            }
        }
    }

    // ----------------------------
    // Round trips
    // ----------------------------

    @Nested
    class RoundTrips {

        @Test
        void decompose_reproducesMatrix_forEveryCode() {
            Random rnd = new Random(42);
            for (AxisCode code : allCodes()) {
                for (int n = 0; n < 200; n++) {
                    Matrix3 m = EulerComposer.compose(randomTriple(rnd), code);
                    AngleTriple t = EulerDecomposer.decompose(m, code);
                    Matrix3 back = EulerComposer.compose(t, code);
                    assertTrue(back.maxAbsDifference(m) < TOL, code + " " + t);
                }
            }
        }

        @Test
        void decomposition_isStableUnderRecomposition() {
            Random rnd = new Random(1234);
            for (AxisCode code : allCodes()) {
                for (int n = 0; n < 50; n++) {
                    Matrix3 m = EulerComposer.compose(randomTriple(rnd), code);
                    AngleTriple first = EulerDecomposer.decompose(m, code);
                    AngleTriple second = EulerDecomposer.decompose(EulerComposer.compose(first, code), code);
                    for (int a = 0; a < 3; a++) {
                        assertTrue(angleDistance(first.get(a), second.get(a)) < 1e-9, code + " " + first + " " + second);
                    }
                }
            }
        }

        @Test
        void extractedAngles_stayInPrincipalRanges() {
            Random rnd = new Random(99);
            for (AxisCode code : allCodes()) {
                AngleTriple t = EulerDecomposer.decompose(EulerComposer.compose(randomTriple(rnd), code), code);
                for (int a = 0; a < 3; a++) {
                    assertTrue(Math.abs(t.get(a)) <= Math.PI, code + " " + t);
                }
                if (code.repetition()) {
                    double middle = code.isOddParity() ? -t.second() : t.second();
                    assertTrue(middle >= 0.0, code + " " + t);
                } else {
                    assertTrue(Math.abs(t.second()) <= Math.PI / 2 + 1e-15, code + " " + t);
                }
            }
        }

        @Test
        void nearGimbalLock_stillReproducesMatrix() {
            for (AxisCode code : allCodes()) {
                double middle = code.repetition() ? 1e-7 : Math.PI / 2 - 1e-7;
                Matrix3 m = EulerComposer.compose(new AngleTriple(0.4, middle, 0.3), code);
                Matrix3 back = EulerComposer.compose(EulerDecomposer.decompose(m, code), code);
                assertTrue(back.maxAbsDifference(m) < TOL, code.toString());
            }
        }
    }

    // ----------------------------
    // Gimbal lock
    // ----------------------------

    @Nested
    class GimbalLock {

        @Test
        void repeatedAxes_rotatingFrame_foldIntoThirdAngle() {
            AngleTriple t = EulerDecomposer.decompose(
                    EulerComposer.compose(new AngleTriple(0.4, 0.0, 0.3), code("ZXZr")), code("ZXZr"));
            assertTriple(0.0, 0.0, 0.7, t);
        }

        @Test
        void repeatedAxes_staticFrame_foldIntoFirstAngle() {
            AngleTriple zxz = EulerDecomposer.decompose(
                    EulerComposer.compose(new AngleTriple(0.4, 0.0, 0.3), code("ZXZs")), code("ZXZs"));
            assertTriple(0.7, 0.0, 0.0, zxz);

            AngleTriple xyx = EulerDecomposer.decompose(
                    EulerComposer.compose(new AngleTriple(0.4, 0.0, 0.3), code("XYXs")), code("XYXs"));
            assertTriple(0.7, 0.0, 0.0, xyx);
        }

        @Test
        void distinctAxes_middleAtRightAngle() {
            AngleTriple xyz = EulerDecomposer.decompose(
                    EulerComposer.compose(new AngleTriple(0.4, Math.PI / 2, 0.3), code("XYZs")), code("XYZs"));
            assertTriple(0.1, Math.PI / 2, 0.0, xyz);

            AngleTriple zyx = EulerDecomposer.decompose(
                    EulerComposer.compose(new AngleTriple(0.4, Math.PI / 2, 0.3), code("ZYXr")), code("ZYXr"));
            assertTriple(0.0, Math.PI / 2, -0.1, zyx);
        }

        @Test
        void lockedDecomposition_reproducesMatrix_forEveryCode() {
            for (AxisCode code : allCodes()) {
                double[] middles = code.repetition()
                        ? new double[]{0.0, Math.PI}
                        : new double[]{Math.PI / 2, -Math.PI / 2};
                for (double middle : middles) {
                    Matrix3 m = EulerComposer.compose(new AngleTriple(0.4, middle, 0.3), code);
                    AngleTriple t = EulerDecomposer.decompose(m, code);
                    assertTrue(t.first() == 0.0 || t.third() == 0.0, code + " " + t);
                    assertTrue(EulerComposer.compose(t, code).maxAbsDifference(m) < TOL, code + " " + t);
                }
            }
        }
    }

    // ----------------------------
    // Static / rotating duality
    // ----------------------------

    @Nested
    class Duality {

        @Test
        @DisplayName("ABCs and CBAr decompose the same matrix into reversed triples")
        void staticAndRotating_areReversed() {
            Random rnd = new Random(5);
            for (AxisCode stat : allCodes()) {
                if (stat.isRotatingFrame()) continue;
                String letters = stat.conventionName().substring(0, 3);
                AxisCode rot = code(new StringBuilder(letters).reverse() + "r");

                for (int n = 0; n < 20; n++) {
                    Matrix3 m = EulerComposer.compose(randomTriple(rnd), stat);
                    AngleTriple s = EulerDecomposer.decompose(m, stat);
                    AngleTriple r = EulerDecomposer.decompose(m, rot);
                    assertEquals(s, r.reversed(), stat + " vs " + rot);
                }
            }
        }

        @Test
        void knownDualPair() {
            Matrix3 m = EulerComposer.compose(new AngleTriple(0.3, -0.7, 1.1), code("ZXZr"));
            AngleTriple xyz = EulerDecomposer.decompose(m, code("XYZs"));
            AngleTriple zyx = EulerDecomposer.decompose(m, code("ZYXr"));

            assertEquals(xyz, zyx.reversed());
            assertTrue(EulerComposer.compose(xyz, code("XYZs")).maxAbsDifference(m) < TOL);
        }
    }
}
