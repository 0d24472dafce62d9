package com.starscape.astrocat.common.wcs;

import java.util.Map;

/**
 * One SIP distortion polynomial: sum of c[p][q] * u^p * v^q for 0 < p + q <= order.
 */
final class SipPolynomial {

    private static final SipPolynomial NONE = new SipPolynomial(0, new double[1][1]);

    private final int order;
    private final double[][] coefficients;

    private SipPolynomial(int order, double[][] coefficients) {
        this.order = order;
        this.coefficients = coefficients;
    }

    static SipPolynomial none() {
        return NONE;
    }

    /**
     * Read {@code <prefix>_ORDER} and {@code <prefix>_p_q} cards. Absent coefficients are zero.
     */
    static SipPolynomial fromHeader(Map<String, Object> header, String prefix) {
        int order = (int) WcsHeaderValues.requireNumber(header, prefix + "_ORDER");
        if (order < 0 || order > 9) {
            throw new IllegalArgumentException(prefix + "_ORDER out of range: " + order);
        }
        double[][] coefficients = new double[order + 1][order + 1];
        for (int p = 0; p <= order; p++) {
            for (int q = 0; p + q <= order; q++) {
                coefficients[p][q] = WcsHeaderValues.optionalNumber(header, prefix + "_" + p + "_" + q, 0.0);
            }
        }
        return new SipPolynomial(order, coefficients);
    }

    double evaluate(double u, double v) {
        double sum = 0.0;
        double uPow = 1.0;
        for (int p = 0; p <= order; p++) {
            double vPow = 1.0;
            for (int q = 0; p + q <= order; q++) {
                sum += coefficients[p][q] * uPow * vPow;
                vPow *= v;
            }
            uPow *= u;
        }
        return sum;
    }
}
