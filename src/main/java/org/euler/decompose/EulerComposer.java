package org.euler.decompose;

import org.euler.convention.AxisCode;
import org.euler.model.AngleTriple;
import org.euler.model.Matrix3;

import java.util.Objects;

/**
 * Euler angles -> rotation matrix for any {@link AxisCode}; the inverse of {@link EulerDecomposer}.
 *
 * Closed form, no degenerate case. For example ZYXr (a, b, c) gives Rz(a) * Ry(b) * Rx(c)
 * and XYZs (a, b, c) gives Rz(c) * Ry(b) * Rx(a), acting on column vectors.
 */
public final class EulerComposer {

    private EulerComposer() {
    }

    public static Matrix3 compose(AngleTriple angles, AxisCode code) {
        Objects.requireNonNull(angles, "angles must not be null");
        Objects.requireNonNull(code, "code must not be null");

        int i = code.i();
        int j = code.j();
        int k = code.k();

        double ai = angles.first();
        double aj = angles.second();
        double ak = angles.third();

        if (code.isRotatingFrame()) {
            double t = ai;
            ai = ak;
            ak = t;
        }
        if (code.isOddParity()) {
            ai = -ai;
            aj = -aj;
            ak = -ak;
        }

        double si = Math.sin(ai), sj = Math.sin(aj), sk = Math.sin(ak);
        double ci = Math.cos(ai), cj = Math.cos(aj), ck = Math.cos(ak);
        double cc = ci * ck, cs = ci * sk;
        double sc = si * ck, ss = si * sk;

        double[][] m = new double[3][3];
        if (code.repetition()) {
            m[i][i] = cj;
            m[i][j] = sj * si;
            m[i][k] = sj * ci;
            m[j][i] = sj * sk;
            m[j][j] = -cj * ss + cc;
            m[j][k] = -cj * cs - sc;
            m[k][i] = -sj * ck;
            m[k][j] = cj * sc + cs;
            m[k][k] = cj * cc - ss;
        } else {
            m[i][i] = cj * ck;
            m[i][j] = sj * sc - cs;
            m[i][k] = sj * cc + ss;
            m[j][i] = cj * sk;
            m[j][j] = sj * ss + cc;
            m[j][k] = sj * cs - sc;
            m[k][i] = -sj;
            m[k][j] = cj * si;
            m[k][k] = cj * ci;
        }
        return new Matrix3(m);
    }
}
