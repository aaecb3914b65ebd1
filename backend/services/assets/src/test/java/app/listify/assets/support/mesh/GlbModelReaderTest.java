package app.listify.assets.support.mesh;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GlbModelReaderTest {

    @Test
    void readsCubeGeometry() throws Exception {
        MeshModel model = GlbModelReader.parse(TestGlbFiles.cube(null, null));

        assertEquals(8, model.vertexCount());
        assertEquals(12, model.triangleCount());
        assertArrayEquals(new double[]{0, 0, 0}, model.center(), 1e-6);
        assertEquals(Math.sqrt(3), model.radius(model.center()), 1e-6);
    }

    @Test
    void appliesNodeTranslation() throws Exception {
        MeshModel model = GlbModelReader.parse(TestGlbFiles.cube(null, new float[]{5, 0, -2}));

        assertArrayEquals(new double[]{5, 0, -2}, model.center(), 1e-6);
    }

    @Test
    void usesMaterialBaseColorForTriangles() throws Exception {
        MeshModel model = GlbModelReader.parse(TestGlbFiles.cube(new float[]{1f, 0f, 0f}, null));

        assertTrue(Arrays.stream(model.triangleColors()).allMatch(color -> color == 0xFFFF0000));
    }

    @Test
    void rejectsNonGlbBytes() {
        byte[] bytes = "definitely not a binary gltf".getBytes();

        IOException ex = assertThrows(IOException.class, () -> GlbModelReader.parse(bytes));
        assertEquals("Not a GLB file", ex.getMessage());
    }

    @Test
    void rejectsTruncatedFile() {
        byte[] full = TestGlbFiles.cube(null, null);
        byte[] truncated = Arrays.copyOf(full, 16);

        assertThrows(IOException.class, () -> GlbModelReader.parse(truncated));
    }
}
