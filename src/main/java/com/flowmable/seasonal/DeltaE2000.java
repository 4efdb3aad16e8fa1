package com.flowmable.seasonal;

/**
 * CIEDE2000 color difference.
 * <p>
 * Full implementation per Sharma, Wu, Dalal (2005) with reference weights
 * kL = kC = kH = 1. Hue angles are carried in degrees, normalized to [0, 360).
 */
public final class DeltaE2000 {

    private DeltaE2000() {}

    private static final double POW_25_7 = Math.pow(25.0, 7);

    private static final double KL = 1.0;
    private static final double KC = 1.0;
    private static final double KH = 1.0;

    /**
     * @return ΔE₀₀ ≥ 0; symmetric in its arguments
     */
    public static double deltaE(Lab lab1, Lab lab2) {
        return deltaE(lab1.l(), lab1.a(), lab1.b(), lab2.l(), lab2.a(), lab2.b());
    }

    public static double deltaE(double L1, double a1, double b1,
                                double L2, double a2, double b2) {
        // 1. Chroma and the a* rotation factor G
        double C1 = Math.sqrt(a1 * a1 + b1 * b1);
        double C2 = Math.sqrt(a2 * a2 + b2 * b2);
        double Cb = (C1 + C2) / 2.0;
        double Cb7 = Math.pow(Cb, 7);
        double G = 0.5 * (1.0 - Math.sqrt(Cb7 / (Cb7 + POW_25_7)));

        // 2. Rescaled a', C', h'
        double a1p = a1 * (1.0 + G);
        double a2p = a2 * (1.0 + G);
        double C1p = Math.sqrt(a1p * a1p + b1 * b1);
        double C2p = Math.sqrt(a2p * a2p + b2 * b2);
        double h1p = hueDegrees(b1, a1p);
        double h2p = hueDegrees(b2, a2p);

        // 3. Deltas
        double dLp = L2 - L1;
        double dCp = C2p - C1p;

        double dhp;
        boolean achromatic = C1p * C2p == 0.0;
        double rawHueDiff = h2p - h1p;
        if (achromatic) {
            dhp = 0.0;
        } else if (Math.abs(rawHueDiff) <= 180.0) {
            dhp = rawHueDiff;
        } else if (rawHueDiff > 180.0) {
            dhp = rawHueDiff - 360.0;
        } else {
            dhp = rawHueDiff + 360.0;
        }
        double dHp = 2.0 * Math.sqrt(C1p * C2p) * Math.sin(Math.toRadians(dhp / 2.0));

        // 4. Means
        double Lbp = (L1 + L2) / 2.0;
        double Cbp = (C1p + C2p) / 2.0;

        double hbp;
        if (achromatic) {
            hbp = h1p + h2p;
        } else if (Math.abs(h1p - h2p) <= 180.0) {
            hbp = (h1p + h2p) / 2.0;
        } else if (h1p + h2p < 360.0) {
            hbp = (h1p + h2p + 360.0) / 2.0;
        } else {
            hbp = (h1p + h2p - 360.0) / 2.0;
        }

        // 5. Weighting functions
        double T = 1.0
                - 0.17 * Math.cos(Math.toRadians(hbp - 30.0))
                + 0.24 * Math.cos(Math.toRadians(2.0 * hbp))
                + 0.32 * Math.cos(Math.toRadians(3.0 * hbp + 6.0))
                - 0.20 * Math.cos(Math.toRadians(4.0 * hbp - 63.0));

        double hueOffset = (hbp - 275.0) / 25.0;
        double dTheta = 30.0 * Math.exp(-hueOffset * hueOffset);

        double Cbp7 = Math.pow(Cbp, 7);
        double RC = 2.0 * Math.sqrt(Cbp7 / (Cbp7 + POW_25_7));

        double Lb50sq = (Lbp - 50.0) * (Lbp - 50.0);
        double SL = 1.0 + 0.015 * Lb50sq / Math.sqrt(20.0 + Lb50sq);
        double SC = 1.0 + 0.045 * Cbp;
        double SH = 1.0 + 0.015 * Cbp * T;
        double RT = -Math.sin(Math.toRadians(2.0 * dTheta)) * RC;

        // 6. Combine
        double lTerm = dLp / (KL * SL);
        double cTerm = dCp / (KC * SC);
        double hTerm = dHp / (KH * SH);

        return Math.sqrt(
                lTerm * lTerm
              + cTerm * cTerm
              + hTerm * hTerm
              + RT * cTerm * hTerm
        );
    }

    private static double hueDegrees(double b, double ap) {
        if (b == 0.0 && ap == 0.0) {
            return 0.0;
        }
        double h = Math.toDegrees(Math.atan2(b, ap));
        return h < 0 ? h + 360.0 : h;
    }
}
