package app.listify.assets.support.mesh;

/**
 * 3x3 rotation matrix, row-major.
 */
public final class Rotation {

    private static final Rotation IDENTITY = new Rotation(new double[]{
            1, 0, 0,
            0, 1, 0,
            0, 0, 1
    });

    private final double[] m;

    private Rotation(double[] m) {
        this.m = m;
    }

    public static Rotation identity() {
        return IDENTITY;
    }

    /**
     * Rotation about the vertical (Y) axis.
     */
    public static Rotation aboutVerticalAxis(double radians) {
        double cos = Math.cos(radians);
        double sin = Math.sin(radians);
        return new Rotation(new double[]{
                cos, 0, sin,
                0, 1, 0,
                -sin, 0, cos
        });
    }

    /**
     * Rotation about the horizontal (X) axis.
     */
    public static Rotation aboutHorizontalAxis(double radians) {
        double cos = Math.cos(radians);
        double sin = Math.sin(radians);
        return new Rotation(new double[]{
                1, 0, 0,
                0, cos, -sin,
                0, sin, cos
        });
    }

    /**
     * Returns {@code this * other}: {@code other} is applied first.
     */
    public Rotation then(Rotation other) {
        double[] o = other.m;
        double[] r = new double[9];
        for (int row = 0; row < 3; row++) {
            for (int col = 0; col < 3; col++) {
                r[row * 3 + col] = m[row * 3] * o[col]
                        + m[row * 3 + 1] * o[3 + col]
                        + m[row * 3 + 2] * o[6 + col];
            }
        }
        return new Rotation(r);
    }

    public void apply(double x, double y, double z, double[] out) {
        out[0] = m[0] * x + m[1] * y + m[2] * z;
        out[1] = m[3] * x + m[4] * y + m[5] * z;
        out[2] = m[6] * x + m[7] * y + m[8] * z;
    }
}
