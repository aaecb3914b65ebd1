package app.listify.assets.support.mesh;

import org.springframework.stereotype.Component;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Flat-shaded orthographic renderer drawing depth-sorted triangles over a white background.
 * The model is normalised to its bounding sphere so any size fills the frame the same way.
 */
@Component
public class SoftwareFrameRenderer implements FrameRenderer {

    private static final double CAMERA_TILT_RADIANS = Math.toRadians(20);
    private static final double FILL_RATIO = 0.45;
    private static final double AMBIENT = 0.35;
    private static final double[] LIGHT = normalize(new double[]{0.4, 0.6, 1.0});

    @Override
    public BufferedImage render(MeshModel model, Rotation rotation, int width, int height) {
        if (model.triangleCount() == 0) {
            throw new IllegalStateException("Model has no triangles to render");
        }
        double[] center = model.center();
        double radius = model.radius(center);
        if (radius <= 0 || Double.isNaN(radius) || Double.isInfinite(radius)) {
            throw new IllegalStateException("Model has degenerate bounds");
        }
        Rotation view = Rotation.aboutHorizontalAxis(CAMERA_TILT_RADIANS).then(rotation);
        double scale = FILL_RATIO * Math.min(width, height) / radius;

        float[] positions = model.positions();
        int vertexCount = model.vertexCount();
        double[] viewSpace = new double[vertexCount * 3];
        double[] out = new double[3];
        for (int v = 0; v < vertexCount; v++) {
            view.apply(positions[v * 3] - center[0], positions[v * 3 + 1] - center[1], positions[v * 3 + 2] - center[2], out);
            viewSpace[v * 3] = out[0];
            viewSpace[v * 3 + 1] = out[1];
            viewSpace[v * 3 + 2] = out[2];
        }

        int[] indices = model.indices();
        int triangleCount = model.triangleCount();
        Integer[] order = new Integer[triangleCount];
        double[] depth = new double[triangleCount];
        for (int t = 0; t < triangleCount; t++) {
            order[t] = t;
            depth[t] = (viewSpace[indices[t * 3] * 3 + 2]
                    + viewSpace[indices[t * 3 + 1] * 3 + 2]
                    + viewSpace[indices[t * 3 + 2] * 3 + 2]) / 3.0;
        }
        Arrays.sort(order, (a, b) -> Double.compare(depth[a], depth[b]));

        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = image.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, width, height);
            int[] xs = new int[3];
            int[] ys = new int[3];
            int[] colors = model.triangleColors();
            for (int t : order) {
                int a = indices[t * 3];
                int b = indices[t * 3 + 1];
                int c = indices[t * 3 + 2];
                double intensity = shade(viewSpace, a, b, c);
                for (int k = 0; k < 3; k++) {
                    int vertex = indices[t * 3 + k];
                    xs[k] = (int) Math.round(width / 2.0 + viewSpace[vertex * 3] * scale);
                    ys[k] = (int) Math.round(height / 2.0 - viewSpace[vertex * 3 + 1] * scale);
                }
                graphics.setColor(lit(colors[t], intensity));
                graphics.fillPolygon(xs, ys, 3);
            }
        } finally {
            graphics.dispose();
        }
        return image;
    }

    private static double shade(double[] v, int a, int b, int c) {
        double ux = v[b * 3] - v[a * 3];
        double uy = v[b * 3 + 1] - v[a * 3 + 1];
        double uz = v[b * 3 + 2] - v[a * 3 + 2];
        double wx = v[c * 3] - v[a * 3];
        double wy = v[c * 3 + 1] - v[a * 3 + 1];
        double wz = v[c * 3 + 2] - v[a * 3 + 2];
        double[] normal = normalize(new double[]{uy * wz - uz * wy, uz * wx - ux * wz, ux * wy - uy * wx});
        // two-sided: generated meshes do not guarantee consistent winding
        double diffuse = Math.abs(normal[0] * LIGHT[0] + normal[1] * LIGHT[1] + normal[2] * LIGHT[2]);
        return AMBIENT + (1 - AMBIENT) * diffuse;
    }

    private static Color lit(int argb, double intensity) {
        int r = (int) Math.min(255, ((argb >> 16) & 0xFF) * intensity);
        int g = (int) Math.min(255, ((argb >> 8) & 0xFF) * intensity);
        int b = (int) Math.min(255, (argb & 0xFF) * intensity);
        return new Color(r, g, b);
    }

    private static double[] normalize(double[] vector) {
        double length = Math.sqrt(vector[0] * vector[0] + vector[1] * vector[1] + vector[2] * vector[2]);
        if (length == 0) {
            return new double[]{0, 0, 0};
        }
        return new double[]{vector[0] / length, vector[1] / length, vector[2] / length};
    }
}
