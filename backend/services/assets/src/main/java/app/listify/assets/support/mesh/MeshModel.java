package app.listify.assets.support.mesh;

/**
 * Triangle soup in world space with one ARGB color per triangle.
 *
 * @param positions       x, y, z per vertex
 * @param indices         three vertex indices per triangle
 * @param triangleColors  one ARGB color per triangle
 */
public record MeshModel(float[] positions, int[] indices, int[] triangleColors) {

    public MeshModel {
        if (positions.length % 3 != 0) {
            throw new IllegalArgumentException("positions must hold x, y, z triples");
        }
        if (indices.length % 3 != 0) {
            throw new IllegalArgumentException("indices must hold whole triangles");
        }
        if (triangleColors.length != indices.length / 3) {
            throw new IllegalArgumentException("one color is required per triangle");
        }
    }

    public int vertexCount() {
        return positions.length / 3;
    }

    public int triangleCount() {
        return indices.length / 3;
    }

    /**
     * Center of the axis-aligned bounding box.
     */
    public double[] center() {
        double[] min = {Double.MAX_VALUE, Double.MAX_VALUE, Double.MAX_VALUE};
        double[] max = {-Double.MAX_VALUE, -Double.MAX_VALUE, -Double.MAX_VALUE};
        for (int i = 0; i < positions.length; i += 3) {
            for (int axis = 0; axis < 3; axis++) {
                min[axis] = Math.min(min[axis], positions[i + axis]);
                max[axis] = Math.max(max[axis], positions[i + axis]);
            }
        }
        if (positions.length == 0) {
            return new double[]{0, 0, 0};
        }
        return new double[]{
                (min[0] + max[0]) / 2,
                (min[1] + max[1]) / 2,
                (min[2] + max[2]) / 2
        };
    }

    /**
     * Largest distance from {@code center} to any vertex.
     */
    public double radius(double[] center) {
        double radius = 0;
        for (int i = 0; i < positions.length; i += 3) {
            double dx = positions[i] - center[0];
            double dy = positions[i + 1] - center[1];
            double dz = positions[i + 2] - center[2];
            radius = Math.max(radius, Math.sqrt(dx * dx + dy * dy + dz * dz));
        }
        return radius;
    }
}
